package com.bidradar.score;

/**
 * Pursue / defer / ignore verdict for one opportunity. Serialized by constant name.
 */
public enum Decision {
    GO,
    MAYBE,
    NO_GO
}
