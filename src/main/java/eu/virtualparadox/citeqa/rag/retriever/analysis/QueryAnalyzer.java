package eu.virtualparadox.citeqa.rag.retriever.analysis;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword heuristics over the lower-cased query.
 * <p>
 * Keywords match on word boundaries. The type rules are checked in declaration order and
 * the first match wins; without a match the query is {@link EQueryType#FACTUAL}. Filter hints
 * take the first matching organization and the first matching topic.
 */
@Component
public class QueryAnalyzer {

    private static final Map<EQueryType, Pattern> TYPE_RULES = new LinkedHashMap<>();
    private static final Map<Pattern, String> ORGANIZATIONS = new LinkedHashMap<>();
    private static final Map<Pattern, String> TOPICS = new LinkedHashMap<>();

    private static final Pattern COMPLEX_WORDS = words("comprehensive", "detailed", "thorough", "in-depth");
    private static final Pattern NARROW_WORDS = words("specific", "particular", "exact", "precise");
    private static final Pattern BROAD_WORDS = words("all", "every", "comprehensive", "complete", "entire", "global");

    static {
        TYPE_RULES.put(EQueryType.FACTUAL, words("what is", "define", "definition", "meaning of"));
        TYPE_RULES.put(EQueryType.COMPARATIVE, words("compare", "difference", "versus", "vs", "contrast"));
        TYPE_RULES.put(EQueryType.PROCEDURAL, words("how to", "steps", "process", "procedure", "protocol"));
        TYPE_RULES.put(EQueryType.ANALYTICAL, words("analyze", "analysis", "evaluate", "assess", "examine"));
        TYPE_RULES.put(EQueryType.EXPLORATORY, words("overview", "about", "tell me about", "explain", "describe"));

        ORGANIZATIONS.put(words("fatf", "financial action task force"), "FATF");
        ORGANIZATIONS.put(words("fiu", "financial intelligence unit"), "FIU");
        ORGANIZATIONS.put(words("un", "united nations"), "UN");
        ORGANIZATIONS.put(words("imf", "international monetary fund"), "IMF");
        ORGANIZATIONS.put(words("world bank"), "World Bank");
        ORGANIZATIONS.put(words("egmont", "egmont group"), "Egmont Group");
        ORGANIZATIONS.put(words("wolfsberg", "wolfsberg group"), "Wolfsberg Group");
        ORGANIZATIONS.put(words("basel", "basel committee"), "Basel Committee");
        ORGANIZATIONS.put(words("oecd"), "OECD");

        TOPICS.put(words("crypto", "virtual asset", "virtual assets", "vasp", "cryptocurrency", "bitcoin",
                "digital currency"), "virtual_assets");
        TOPICS.put(words("sanction", "sanctions", "sanctioned", "embargo"), "sanctions");
        TOPICS.put(words("beneficial ownership", "beneficial owner", "bo", "ubo", "ultimate beneficial"),
                "beneficial_ownership");
        TOPICS.put(words("cdd", "customer due diligence", "kyc", "know your customer"), "customer_due_diligence");
        TOPICS.put(words("edd", "enhanced due diligence"), "enhanced_due_diligence");
        TOPICS.put(words("pep", "peps", "politically exposed", "politically exposed person"), "peps");
        TOPICS.put(words("risk assessment", "risk based approach", "rba", "risk management"), "risk_assessment");
        TOPICS.put(words("transaction monitoring", "suspicious transaction", "unusual transaction"),
                "transaction_monitoring");
        TOPICS.put(words("sar", "str", "suspicious activity report", "suspicious transaction report"),
                "suspicious_activity_reporting");
        TOPICS.put(words("wire transfer", "funds transfer", "remittance"), "wire_transfers");
        TOPICS.put(words("tbml", "trade based", "trade finance"), "trade_based_money_laundering");
        TOPICS.put(words("correspondent bank", "correspondent banking", "nostro", "vostro"), "correspondent_banking");
        TOPICS.put(words("dnfbp", "designated non-financial", "casino", "real estate", "lawyer", "accountant"),
                "dnfbps");
        TOPICS.put(words("npo", "non-profit", "nonprofit", "charity", "charitable"), "non_profit_organizations");
        TOPICS.put(words("terrorism financing", "terrorist financing", "ctf", "cft", "counter terrorism"),
                "terrorism_financing");
        TOPICS.put(words("money laundering", "aml", "anti money laundering", "laundering"), "money_laundering");
        TOPICS.put(words("proliferation financing", "wmd", "weapons of mass destruction"), "proliferation_financing");
    }

    public QueryCharacteristics analyze(final String query) {
        final String lower = query == null ? "" : query.toLowerCase(Locale.ROOT);
        final int wordCount = wordCount(query);

        return new QueryCharacteristics(
                wordCount,
                detectType(lower),
                detectComplexity(lower, wordCount),
                detectScope(lower),
                detectFilterHints(lower));
    }

    public static int wordCount(final String query) {
        return StringUtils.split(StringUtils.defaultString(query)).length;
    }

    private EQueryType detectType(final String lower) {
        for (final Map.Entry<EQueryType, Pattern> rule : TYPE_RULES.entrySet()) {
            if (rule.getValue().matcher(lower).find()) {
                return rule.getKey();
            }
        }
        return EQueryType.FACTUAL;
    }

    private EQueryComplexity detectComplexity(final String lower, final int wordCount) {
        if (wordCount < 5) {
            return EQueryComplexity.SIMPLE;
        }
        if (wordCount > 15 || COMPLEX_WORDS.matcher(lower).find()) {
            return EQueryComplexity.COMPLEX;
        }
        return EQueryComplexity.MODERATE;
    }

    private EQueryScope detectScope(final String lower) {
        if (NARROW_WORDS.matcher(lower).find()) {
            return EQueryScope.NARROW;
        }
        if (BROAD_WORDS.matcher(lower).find()) {
            return EQueryScope.BROAD;
        }
        return EQueryScope.MEDIUM;
    }

    private List<FilterHint> detectFilterHints(final String lower) {
        final List<FilterHint> hints = new ArrayList<>(2);
        firstMatch(ORGANIZATIONS, lower, EFilterHintKind.ORGANIZATION, hints);
        firstMatch(TOPICS, lower, EFilterHintKind.TOPIC, hints);
        return hints;
    }

    private static void firstMatch(final Map<Pattern, String> dictionary,
                                   final String lower,
                                   final EFilterHintKind kind,
                                   final List<FilterHint> hints) {
        for (final Map.Entry<Pattern, String> entry : dictionary.entrySet()) {
            if (entry.getKey().matcher(lower).find()) {
                hints.add(new FilterHint(kind, entry.getValue()));
                return;
            }
        }
    }

    private static Pattern words(final String... keywords) {
        final StringBuilder alternatives = new StringBuilder();
        for (final String keyword : keywords) {
            if (alternatives.length() > 0) {
                alternatives.append('|');
            }
            alternatives.append(Pattern.quote(keyword));
        }
        return Pattern.compile("(?<![a-z0-9])(?:" + alternatives + ")(?![a-z0-9])");
    }
}
