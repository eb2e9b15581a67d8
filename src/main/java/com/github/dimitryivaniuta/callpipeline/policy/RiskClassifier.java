package com.github.dimitryivaniuta.callpipeline.policy;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Classifies a method by the verb at the end of its name. A {@code batch} call is as risky
 * as its riskiest sub-command.
 */
public final class RiskClassifier {

    private static final Pattern DESTRUCTIVE =
            Pattern.compile("(?:^|\\.)(delete|remove|recyclebin|unregister|unbind)$");
    private static final Pattern WRITE =
            Pattern.compile("(?:^|\\.)(add|update|set|register|bind|import|complete|start|stop|move|clear)$");

    private RiskClassifier() {}

    public static RiskTier classify(String method, Map<String, ?> params) {
        String m = method.toLowerCase(Locale.ROOT);
        if ("batch".equals(m)) {
            RiskTier worst = RiskTier.READ;
            Object cmd = (params == null) ? null : params.get("cmd");
            if (cmd instanceof Map<?, ?> commands) {
                for (Object command : commands.values()) {
                    if (command instanceof String s) {
                        worst = RiskTier.max(worst, classify(batchCommandMethod(s), null));
                    }
                }
            }
            return worst;
        }

        if (DESTRUCTIVE.matcher(m).find()) return RiskTier.DESTRUCTIVE;
        if (WRITE.matcher(m).find()) return RiskTier.WRITE;
        return RiskTier.READ;
    }

    /** Method part of a batch command ({@code "crm.deal.add?fields[TITLE]=x"} gives {@code crm.deal.add}). */
    public static String batchCommandMethod(String command) {
        int q = command.indexOf('?');
        String method = (q >= 0) ? command.substring(0, q) : command;
        return method.trim().toLowerCase(Locale.ROOT);
    }
}
