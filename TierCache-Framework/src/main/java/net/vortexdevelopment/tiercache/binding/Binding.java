package net.vortexdevelopment.tiercache.binding;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import net.vortexdevelopment.tiercache.CacheTier;
import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * Ties an application event to a cache entry: triggering the event removes the entry from the
 * given tier.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Binding implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String event;
    private final String id;
    private final String realm;
    private final CacheTier tier;

    public Binding(@NotNull String event, @NotNull String id, @NotNull String realm, @NotNull CacheTier tier) {
        this.event = Objects.requireNonNull(event, "event");
        this.id = Objects.requireNonNull(id, "id");
        this.realm = Objects.requireNonNull(realm, "realm");
        this.tier = Objects.requireNonNull(tier, "tier");
    }

    public static Binding of(String event, String id, String realm, CacheTier tier) {
        return new Binding(event, id, realm, tier);
    }
}
