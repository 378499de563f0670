package dev.spellkit.affix.entry;

import dev.spellkit.affix.condition.CharacterConditionGroup;
import dev.spellkit.affix.flag.FlagValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * Ordered list of open affix groups of one direction, searched by flag.
 *
 * @param <E> entry type created for this direction
 */
public final class AffixGroupTable<E extends AffixEntry> {

    /**
     * Creates the entry type of a direction.
     */
    @FunctionalInterface
    public interface EntryFactory<E extends AffixEntry> {
        E create(String strip, String affix, CharacterConditionGroup condition,
                 SortedSet<FlagValue> continuationClass, List<String> morphology);
    }

    private final AffixKind kind;
    private final EntryFactory<E> factory;
    private final List<AffixEntryGroup.Builder<E>> groups = new ArrayList<>();

    private AffixGroupTable(AffixKind kind, EntryFactory<E> factory) {
        this.kind = kind;
        this.factory = factory;
    }

    public static AffixGroupTable<PrefixEntry> prefixes() {
        return new AffixGroupTable<>(AffixKind.PREFIX, PrefixEntry::new);
    }

    public static AffixGroupTable<SuffixEntry> suffixes() {
        return new AffixGroupTable<>(AffixKind.SUFFIX, SuffixEntry::new);
    }

    public AffixKind kind() {
        return kind;
    }

    public Optional<AffixEntryGroup.Builder<E>> find(FlagValue flag) {
        for (int i = groups.size() - 1; i >= 0; i--) {
            if (groups.get(i).flag().equals(flag)) {
                return Optional.of(groups.get(i));
            }
        }
        return Optional.empty();
    }

    public boolean isOpen(FlagValue flag) {
        return find(flag).isPresent();
    }

    public AffixEntryGroup.Builder<E> open(FlagValue flag, Set<AffixEntryOption> options, int expectedEntryCount) {
        if (isOpen(flag)) {
            throw new IllegalStateException("group already open for " + flag);
        }
        AffixEntryGroup.Builder<E> group = new AffixEntryGroup.Builder<>(flag, options, expectedEntryCount);
        groups.add(group);
        return group;
    }

    /**
     * Adds an entry to the group of {@code flag}, opening a group with default options when none exists.
     */
    public E addEntry(FlagValue flag, String strip, String affix, CharacterConditionGroup condition,
                      SortedSet<FlagValue> continuationClass, List<String> morphology) {
        E entry = factory.create(strip, affix, condition, continuationClass, morphology);
        AffixEntryGroup.Builder<E> group = find(flag).orElseGet(() -> open(flag, Set.of(), 0));
        group.add(entry);
        return entry;
    }

    public int groupCount() {
        return groups.size();
    }

    public List<AffixEntryGroup<E>> freeze() {
        return groups.stream()
                .map(AffixEntryGroup.Builder::build)
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        return "AffixGroupTable[" + kind + ", groups=" + groups.size() + "]";
    }
}
