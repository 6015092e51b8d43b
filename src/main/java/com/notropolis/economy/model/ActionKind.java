package com.notropolis.economy.model;

/**
 * Kinds of entries in the transaction log.
 */
public enum ActionKind {
    BUY_LAND(true),
    BUILD(true),
    DEMOLISH(true),
    LIST_FOR_SALE(true),
    CANCEL_LISTING(true),
    BUY_PROPERTY(true),
    SECURITY_PURCHASE(true),
    ATTACK(true),
    PAY_FINE(false),
    SELL_PROPERTY(false),
    CAUGHT_BY_POLICE(false),
    TICK_INCOME(false),
    LEVEL_UP(false);

    private final boolean gated;

    ActionKind(boolean gated) {
        this.gated = gated;
    }

    /**
     * Company-initiated mutating actions that are refused while imprisoned.
     */
    public boolean isGated() {
        return gated;
    }
}
