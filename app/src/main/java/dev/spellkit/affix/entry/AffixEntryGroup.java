package dev.spellkit.affix.entry;

import dev.spellkit.affix.flag.FlagValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * All entries of one direction sharing a flag, together with the options of their header line.
 *
 * @param <E> entry type
 */
public final class AffixEntryGroup<E extends AffixEntry> {

    private final FlagValue flag;
    private final Set<AffixEntryOption> options;
    private final List<E> entries;

    public AffixEntryGroup(FlagValue flag, Set<AffixEntryOption> options, List<E> entries) {
        this.flag = Objects.requireNonNull(flag, "flag");
        this.options = options.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(AffixEntryOption.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(options));
        this.entries = List.copyOf(entries);
    }

    public FlagValue flag() {
        return flag;
    }

    public Set<AffixEntryOption> options() {
        return options;
    }

    public boolean allowsCrossProduct() {
        return options.contains(AffixEntryOption.CROSS_PRODUCT);
    }

    public List<E> entries() {
        return entries;
    }

    @Override
    public String toString() {
        return "AffixEntryGroup[flag=" + flag + ", options=" + options + ", entries=" + entries.size() + "]";
    }

    /**
     * Mutable group used while the affix file is being read.
     */
    public static final class Builder<E extends AffixEntry> {

        private final FlagValue flag;
        private final EnumSet<AffixEntryOption> options;
        private final List<E> entries;

        public Builder(FlagValue flag, Set<AffixEntryOption> options, int expectedEntryCount) {
            this.flag = Objects.requireNonNull(flag, "flag");
            this.options = options.isEmpty() ? EnumSet.noneOf(AffixEntryOption.class) : EnumSet.copyOf(options);
            this.entries = new ArrayList<>(Math.max(0, Math.min(expectedEntryCount, 1 << 12)));
        }

        public FlagValue flag() {
            return flag;
        }

        public Set<AffixEntryOption> options() {
            return Collections.unmodifiableSet(options);
        }

        public List<E> entries() {
            return Collections.unmodifiableList(entries);
        }

        public Builder<E> add(E entry) {
            entries.add(Objects.requireNonNull(entry, "entry"));
            return this;
        }

        public AffixEntryGroup<E> build() {
            return new AffixEntryGroup<>(flag, options, entries);
        }
    }
}
