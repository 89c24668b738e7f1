package com.qubi.netmap.core.model;

public enum LinkType {
    GATEWAY,         // estrella hacia el gateway de la subred
    MESH,            // subred chica sin gateway
    BACKBONE,        // entre gateways router de distintas subredes
    INFRASTRUCTURE,  // la inferencia no genera estos dos
    ACCESS
}
