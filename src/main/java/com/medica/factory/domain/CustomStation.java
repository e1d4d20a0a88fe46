package com.medica.factory.domain;

/**
 * Stations a custom order passes through, in route order.
 */
public enum CustomStation {
    WAITING,
    MCE,
    WMA_PASS1,
    WMA_PASS2,
    PUC,
    ARCP,
    COMPLETE;

    public CustomStation next() {
        return switch (this) {
            case WAITING -> MCE;
            case MCE -> WMA_PASS1;
            case WMA_PASS1 -> WMA_PASS2;
            case WMA_PASS2 -> PUC;
            case PUC -> ARCP;
            case ARCP, COMPLETE -> COMPLETE;
        };
    }
}
