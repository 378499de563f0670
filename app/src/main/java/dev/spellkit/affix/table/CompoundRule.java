package dev.spellkit.affix.table;

import dev.spellkit.affix.flag.FlagValue;
import dev.spellkit.affix.table.CompoundRuleToken.FlagSetToken;
import dev.spellkit.affix.table.CompoundRuleToken.FlagToken;
import dev.spellkit.affix.table.CompoundRuleToken.Quantifier;
import dev.spellkit.affix.table.CompoundRuleToken.WildcardToken;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A COMPOUNDRULE pattern over the flags of compound components.
 *
 * <p>Each flag token consumes one component; {@code *} and {@code ?} quantify the token before them.
 */
public final class CompoundRule {

    private final List<CompoundRuleToken> tokens;
    private final List<Step> steps;

    public CompoundRule(List<CompoundRuleToken> tokens) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        this.steps = compile(this.tokens);
    }

    public List<CompoundRuleToken> tokens() {
        return tokens;
    }

    /**
     * Tests whether the whole component sequence satisfies the rule.
     *
     * @param componentFlags flags of each compound component, in word order
     */
    public boolean matches(List<? extends Collection<FlagValue>> componentFlags) {
        Objects.requireNonNull(componentFlags, "componentFlags");
        return match(0, 0, componentFlags);
    }

    private boolean match(int stepIndex, int componentIndex, List<? extends Collection<FlagValue>> components) {
        if (stepIndex == steps.size()) {
            return componentIndex == components.size();
        }
        Step step = steps.get(stepIndex);
        boolean accepts = componentIndex < components.size() && step.accepts(components.get(componentIndex));
        if (step.quantifier == null) {
            return accepts && match(stepIndex + 1, componentIndex + 1, components);
        }
        return switch (step.quantifier) {
            case ZERO_OR_ONE -> match(stepIndex + 1, componentIndex, components)
                    || (accepts && match(stepIndex + 1, componentIndex + 1, components));
            case ZERO_OR_MORE -> match(stepIndex + 1, componentIndex, components)
                    || (accepts && match(stepIndex, componentIndex + 1, components));
        };
    }

    private static List<Step> compile(List<CompoundRuleToken> tokens) {
        List<Step> compiled = new ArrayList<>(tokens.size());
        for (CompoundRuleToken token : tokens) {
            if (token instanceof WildcardToken wildcard) {
                int last = compiled.size() - 1;
                // a wildcard with nothing to repeat carries no constraint
                if (last >= 0 && compiled.get(last).quantifier == null) {
                    compiled.set(last, new Step(compiled.get(last).token, wildcard.quantifier()));
                }
            } else {
                compiled.add(new Step(token, null));
            }
        }
        return compiled;
    }

    @Override
    public boolean equals(Object other) {
        return this == other || (other instanceof CompoundRule rule && tokens.equals(rule.tokens));
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return "CompoundRule" + tokens;
    }

    private record Step(CompoundRuleToken token, Quantifier quantifier) {

        boolean accepts(Collection<FlagValue> componentFlags) {
            if (token instanceof FlagToken flagToken) {
                return flagToken.accepts(componentFlags);
            }
            return token instanceof FlagSetToken setToken && setToken.accepts(componentFlags);
        }
    }
}
