package com.grantradar.catalog.classify;

import com.grantradar.config.RadarProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The rule tables the classifier dispatches over. Jurisdiction rules are evaluated in order
 * and the first match wins; tag rules are all evaluated and every match contributes its tag.
 */
public record ClassificationRules(
    List<TagRule> audience,
    List<TagRule> discipline,
    List<JurisdictionRule> jurisdictions,
    Pattern tenderUrl,
    Pattern tenderText,
    Pattern closeDateMarker,
    String locality,
    String councilHostPattern
) {
    public ClassificationRules {
        audience = List.copyOf(audience);
        discipline = List.copyOf(discipline);
        jurisdictions = List.copyOf(jurisdictions);
    }

    public static ClassificationRules fromProperties(RadarProperties properties) {
        RadarProperties.Rules rules = properties.getRules();
        List<JurisdictionRule> jurisdictionRules = new ArrayList<>();
        for (RadarProperties.JurisdictionRule rule : rules.getJurisdictions()) {
            jurisdictionRules.add(new JurisdictionRule(rule.getMatch(), rule.getValue(), rule.getJurisdiction()));
        }
        return new ClassificationRules(
            tagRules(rules.getAudience()),
            tagRules(rules.getDiscipline()),
            jurisdictionRules,
            Pattern.compile(rules.getTenderUrlPattern(), Pattern.CASE_INSENSITIVE),
            Pattern.compile(rules.getTenderTextPattern(), Pattern.CASE_INSENSITIVE),
            Pattern.compile(rules.getCloseDateMarker(), Pattern.CASE_INSENSITIVE),
            properties.getLocality(),
            properties.getCouncilHostPattern()
        );
    }

    public Optional<String> jurisdictionFor(String netloc) {
        for (JurisdictionRule rule : jurisdictions) {
            if (rule.matches(netloc)) {
                return Optional.ofNullable(rule.jurisdiction());
            }
        }
        return Optional.empty();
    }

    private static List<TagRule> tagRules(Map<String, String> table) {
        List<TagRule> out = new ArrayList<>();
        table.forEach((tag, regex) -> out.add(TagRule.of(tag, regex)));
        return out;
    }
}
