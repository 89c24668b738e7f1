package com.qubi.netmap.core.model;

public enum EventKind {
    SIGHTED,     // alta o actualización parcial de un device
    REMOVED,     // baja explícita
    SNAPSHOT,    // reenvío completo (pull o initialData)
    METRICS      // métricas de un device conocido
}
