package dev.fumaz.graft.bind;

import dev.fumaz.graft.exception.AliasCycleException;
import dev.fumaz.graft.exception.AliasException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps alias names to target ids.
 * <p>
 * Targets may themselves be aliases or may not be bound yet, so cycles are only detected when an id is
 * canonicalized.
 */
public final class AliasTable {

    private final ConcurrentMap<String, String> aliases = new ConcurrentHashMap<>();

    /**
     * @throws AliasException if {@code alias} equals {@code target}
     */
    public void set(@NotNull String alias, @NotNull String target) {
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(target, "target");

        if (alias.equals(target)) {
            throw new AliasException("Cannot alias '" + alias + "' to itself");
        }

        aliases.put(alias, target);
    }

    /**
     * Follows alias links until reaching an id that is not an alias.
     *
     * @throws AliasCycleException if the links revisit an id
     */
    public @NotNull String canonicalize(@NotNull String id) {
        String target = aliases.get(id);

        if (target == null) {
            return id;
        }

        List<String> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String current = id;

        chain.add(current);
        seen.add(current);

        while (target != null) {
            chain.add(target);

            if (!seen.add(target)) {
                throw new AliasCycleException(chain);
            }

            current = target;
            target = aliases.get(current);
        }

        return current;
    }

    public boolean isAlias(@NotNull String id) {
        return aliases.containsKey(id);
    }

    public boolean remove(@NotNull String alias) {
        return aliases.remove(alias) != null;
    }

    public void clear() {
        aliases.clear();
    }

    public @NotNull Map<String, String> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

}
