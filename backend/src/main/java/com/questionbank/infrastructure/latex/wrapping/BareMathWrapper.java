package com.questionbank.infrastructure.latex.wrapping;

import com.questionbank.infrastructure.latex.LatexRepairSettings;
import com.questionbank.infrastructure.latex.preprocessing.SpanTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the wrap rules over the masked document, most specific first.
 * Every accepted match is protected immediately, so later rules only see
 * the text that earlier rules left bare.
 */
@Slf4j
@Component
public class BareMathWrapper {

    private final List<WrapRule> rules;

    public BareMathWrapper(LatexRepairSettings settings) {
        EquationRule equation = new EquationRule(settings.clauseKeywords());
        // The equation rule runs again last: a left-hand side such as \frac{a}{b}
        // only becomes a span through the residual rules.
        this.rules = List.of(
                new TrigDegreeRule(),
                new ComparisonLineRule(settings.sentenceOpeners()),
                equation,
                new DegreeNotationRule(),
                new CommandRule(),
                new ScriptedIdentifierRule(),
                equation
        );
    }

    public String wrap(String masked, SpanTable spans) {
        if (masked == null || masked.isEmpty()) {
            return masked;
        }

        String result = masked;
        for (WrapRule rule : rules) {
            int before = spans.size();
            result = rule.apply(result, spans);
            if (spans.size() > before) {
                log.debug("Rule {} wrapped {} spans", rule.name(), spans.size() - before);
            }
        }
        return result;
    }

    public List<String> ruleNames() {
        return rules.stream().map(WrapRule::name).toList();
    }
}
