package com.flagship.game_economy.common;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Global acquisition order for row locks.
 *
 * Every component that locks more than one row sorts the identifiers with this
 * comparator first. The string form matches PostgreSQL's uuid ordering, so the
 * order is the same whether it is computed in Java or by the database.
 */
public final class LockOrdering {

    public static final Comparator<UUID> ASCENDING = Comparator.comparing(UUID::toString);

    private LockOrdering() {
    }

    /**
     * Distinct, non-null identifiers in lock acquisition order.
     */
    public static List<UUID> inLockOrder(Collection<UUID> ids) {
        return ids.stream()
                .filter(Objects::nonNull)
                .distinct()
                .sorted(ASCENDING)
                .toList();
    }
}
