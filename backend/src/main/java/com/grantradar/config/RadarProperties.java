package com.grantradar.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "radar")
public class RadarProperties {
    private static final String DEFAULT_LOCALITY = "Wyndham";
    private static final String DEFAULT_ZONE = "Australia/Melbourne";

    private String council = "Wyndham City Council";
    private String locality = DEFAULT_LOCALITY;
    private String councilHostPattern = "wyndham.vic.gov.au";
    private String zone = DEFAULT_ZONE;
    private List<String> preferredJurisdictions = new ArrayList<>(List.of("VIC", "Commonwealth"));
    private List<String> audienceDefaults = new ArrayList<>(List.of("community", "business", "nonprofit"));
    private int closingWindowDays = 14;
    private int recentDays = 7;
    private Data data = new Data();
    private Rules rules = new Rules();
    private Enrichment enrichment = new Enrichment();
    private Cli cli = new Cli();
    private Digest digest = new Digest();
    private List<Seed> seeds = new ArrayList<>();

    public String getCouncil() {
        return council;
    }

    public void setCouncil(String council) {
        this.council = council;
    }

    public String getLocality() {
        return normalizeLocality(locality);
    }

    public void setLocality(String locality) {
        this.locality = normalizeLocality(locality);
    }

    public String getCouncilHostPattern() {
        return councilHostPattern;
    }

    public void setCouncilHostPattern(String councilHostPattern) {
        this.councilHostPattern = councilHostPattern;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public ZoneId getZoneId() {
        if (zone == null || zone.isBlank()) {
            return ZoneId.of(DEFAULT_ZONE);
        }
        try {
            return ZoneId.of(zone.trim());
        } catch (DateTimeException ex) {
            return ZoneId.of(DEFAULT_ZONE);
        }
    }

    public List<String> getPreferredJurisdictions() {
        return preferredJurisdictions;
    }

    public void setPreferredJurisdictions(List<String> preferredJurisdictions) {
        this.preferredJurisdictions = preferredJurisdictions == null ? new ArrayList<>() : preferredJurisdictions;
    }

    public List<String> getAudienceDefaults() {
        return audienceDefaults;
    }

    public void setAudienceDefaults(List<String> audienceDefaults) {
        this.audienceDefaults = audienceDefaults == null ? new ArrayList<>() : audienceDefaults;
    }

    public int getClosingWindowDays() {
        return clampWindow(closingWindowDays);
    }

    public void setClosingWindowDays(int closingWindowDays) {
        this.closingWindowDays = clampWindow(closingWindowDays);
    }

    public int getRecentDays() {
        return Math.max(0, recentDays);
    }

    public void setRecentDays(int recentDays) {
        this.recentDays = Math.max(0, recentDays);
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public Rules getRules() {
        return rules;
    }

    public void setRules(Rules rules) {
        this.rules = rules;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Digest getDigest() {
        return digest;
    }

    public void setDigest(Digest digest) {
        this.digest = digest;
    }

    public List<Seed> getSeeds() {
        return seeds;
    }

    public void setSeeds(List<Seed> seeds) {
        this.seeds = seeds == null ? new ArrayList<>() : seeds;
    }

    public static String normalizeLocality(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_LOCALITY;
        }
        return candidate.trim();
    }

    public static int clampWindow(int days) {
        return Math.min(365, Math.max(1, days));
    }

    public static class Data {
        private String path;
        private List<String> candidates = new ArrayList<>(List.of(
            "grants.json",
            "data/grants.json",
            "grants.jsonl",
            "data/grants.jsonl"
        ));

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public List<String> getCandidates() {
            return candidates;
        }

        public void setCandidates(List<String> candidates) {
            this.candidates = candidates == null ? new ArrayList<>() : candidates;
        }
    }

    public static class Rules {
        private Map<String, String> audience = defaultAudienceRules();
        private Map<String, String> discipline = defaultDisciplineRules();
        private List<JurisdictionRule> jurisdictions = defaultJurisdictionRules();
        private String tenderUrlPattern = "tender|atm|rft|rfq|rfp|contract";
        private String tenderTextPattern = "\\btender\\b";
        private String closeDateMarker = "(close[sd]?|deadline)[^0-9A-Za-z]{0,10}([A-Za-z0-9 ,/\\-:]+)";

        public Map<String, String> getAudience() {
            return audience;
        }

        public void setAudience(Map<String, String> audience) {
            this.audience = audience == null ? new LinkedHashMap<>() : audience;
        }

        public Map<String, String> getDiscipline() {
            return discipline;
        }

        public void setDiscipline(Map<String, String> discipline) {
            this.discipline = discipline == null ? new LinkedHashMap<>() : discipline;
        }

        public List<JurisdictionRule> getJurisdictions() {
            return jurisdictions;
        }

        public void setJurisdictions(List<JurisdictionRule> jurisdictions) {
            this.jurisdictions = jurisdictions == null ? new ArrayList<>() : jurisdictions;
        }

        public String getTenderUrlPattern() {
            return tenderUrlPattern;
        }

        public void setTenderUrlPattern(String tenderUrlPattern) {
            this.tenderUrlPattern = tenderUrlPattern;
        }

        public String getTenderTextPattern() {
            return tenderTextPattern;
        }

        public void setTenderTextPattern(String tenderTextPattern) {
            this.tenderTextPattern = tenderTextPattern;
        }

        public String getCloseDateMarker() {
            return closeDateMarker;
        }

        public void setCloseDateMarker(String closeDateMarker) {
            this.closeDateMarker = closeDateMarker;
        }

        private static Map<String, String> defaultAudienceRules() {
            Map<String, String> rules = new LinkedHashMap<>();
            rules.put("community", "\\b(community|club|not[- ]?for[- ]?profit|nfp|volunteer|arts|sport)\\b");
            rules.put("business", "\\b(business|sme|startup|company|commerciali[sz]ation)\\b");
            rules.put("students", "\\b(student|scholarship|undergrad|postgrad|hdr|phd)\\b");
            rules.put("research", "\\b(research|r&d|fellowship|grant round|arc|nhmrc)\\b");
            return rules;
        }

        private static Map<String, String> defaultDisciplineRules() {
            Map<String, String> rules = new LinkedHashMap<>();
            rules.put("health", "\\b(health|medical|hospital|clinic|nhmrc)\\b");
            rules.put("engineering", "\\b(engineer|infrastructure|transport|construction)\\b");
            rules.put("environment", "\\b(environment|sustainab|recycl|waste|emission|energy)\\b");
            rules.put("arts", "\\b(arts?|creative|culture)\\b");
            rules.put("sport", "\\b(sport|recreation)\\b");
            return rules;
        }

        private static List<JurisdictionRule> defaultJurisdictionRules() {
            return new ArrayList<>(List.of(
                new JurisdictionRule(HostMatch.CONTAINS, "grants.gov.au", "Commonwealth"),
                new JurisdictionRule(HostMatch.CONTAINS, "business.gov.au", "Commonwealth"),
                new JurisdictionRule(HostMatch.CONTAINS, "austender", "Commonwealth"),
                new JurisdictionRule(HostMatch.SUFFIX, ".vic.gov.au", "VIC"),
                new JurisdictionRule(HostMatch.CONTAINS, "business.vic.gov.au", "VIC")
            ));
        }
    }

    public enum HostMatch {
        CONTAINS,
        SUFFIX
    }

    public static class JurisdictionRule {
        private HostMatch match = HostMatch.CONTAINS;
        private String value;
        private String jurisdiction;

        public JurisdictionRule() {
        }

        public JurisdictionRule(HostMatch match, String value, String jurisdiction) {
            this.match = match;
            this.value = value;
            this.jurisdiction = jurisdiction;
        }

        public HostMatch getMatch() {
            return match;
        }

        public void setMatch(HostMatch match) {
            this.match = match == null ? HostMatch.CONTAINS : match;
        }

        public String getValue() {
            return value;
        }

        public void setValue(String value) {
            this.value = value;
        }

        public String getJurisdiction() {
            return jurisdiction;
        }

        public void setJurisdiction(String jurisdiction) {
            this.jurisdiction = jurisdiction;
        }
    }

    public static class Enrichment {
        private int parallelism = 1;

        public int getParallelism() {
            return Math.max(1, parallelism);
        }

        public void setParallelism(int parallelism) {
            this.parallelism = Math.max(1, parallelism);
        }
    }

    public static class Cli {
        private boolean enrich;
        private String in = "grants.json";
        private String out;
        private boolean exitAfterRun = true;

        public boolean isEnrich() {
            return enrich;
        }

        public void setEnrich(boolean enrich) {
            this.enrich = enrich;
        }

        public String getIn() {
            return in;
        }

        public void setIn(String in) {
            this.in = in;
        }

        public String getOut() {
            return out;
        }

        public void setOut(String out) {
            this.out = out;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    public static class Digest {
        private int limit = 25;
        private Integer closingDays;
        private boolean onlyLocality;
        private String subjectPrefix = "[Wyndham]";

        public int getLimit() {
            return Math.max(1, limit);
        }

        public void setLimit(int limit) {
            this.limit = Math.max(1, limit);
        }

        public Integer getClosingDays() {
            return closingDays;
        }

        public void setClosingDays(Integer closingDays) {
            this.closingDays = closingDays == null ? null : clampWindow(closingDays);
        }

        public boolean isOnlyLocality() {
            return onlyLocality;
        }

        public void setOnlyLocality(boolean onlyLocality) {
            this.onlyLocality = onlyLocality;
        }

        public String getSubjectPrefix() {
            return subjectPrefix;
        }

        public void setSubjectPrefix(String subjectPrefix) {
            this.subjectPrefix = subjectPrefix;
        }
    }

    public static class Seed {
        private String title;
        private String url;

        public Seed() {
        }

        public Seed(String title, String url) {
            this.title = title;
            this.url = url;
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }
}
