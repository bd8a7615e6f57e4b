package com.liftrx.model.domain;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 近期训练恢复窗口
 *
 * @param last24h 24小时内刺激过的肌群
 * @param last48h 24-48小时内刺激过的肌群 (与 last24h 不相交)
 */
public record RecoveryWindows(Set<String> last24h, Set<String> last48h) {

    private static final RecoveryWindows NONE = new RecoveryWindows(Set.of(), Set.of());

    public RecoveryWindows {
        last24h = last24h == null ? Set.of() : Set.copyOf(last24h);
        Set<String> older = new LinkedHashSet<>(last48h == null ? Set.of() : last48h);
        older.removeAll(last24h);
        last48h = Set.copyOf(older);
    }

    public static RecoveryWindows none() {
        return NONE;
    }

    public boolean isEmpty() {
        return last24h.isEmpty() && last48h.isEmpty();
    }
}
