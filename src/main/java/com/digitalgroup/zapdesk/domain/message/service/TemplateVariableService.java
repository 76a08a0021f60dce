package com.digitalgroup.zapdesk.domain.message.service;

import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.util.PhoneUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {{variable}} and {variable} placeholders in outgoing text.
 * Keys are case-insensitive. Variables without a value render as [key],
 * or disappear when removeUnmatched is set. Substituted values are never
 * scanned again, so braces inside a lead's data are kept as typed.
 */
@Service
public class TemplateVariableService {

    private static final Locale PT_BR = Locale.forLanguageTag("pt-BR");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}|\\{(\\w+)}");

    private final ZoneId zone;

    public TemplateVariableService(@Value("${zapdesk.timezone:America/Sao_Paulo}") String timezone) {
        this.zone = ZoneId.of(timezone);
    }

    public String render(String content, Lead lead, String agentName) {
        return render(content, lead, agentName, false);
    }

    public String render(String content, Lead lead, String agentName, boolean removeUnmatched) {
        if (content == null || content.indexOf('{') < 0) {
            return content;
        }

        Map<String, String> values = values(lead, agentName);
        return PLACEHOLDER.matcher(content).replaceAll(match -> {
            String written = match.group(1) != null ? match.group(1) : match.group(2);
            String key = written.toLowerCase(Locale.ROOT);
            String value = values.get(key);
            String replacement;
            if (value != null && !value.isEmpty()) {
                replacement = value;
            } else if (removeUnmatched) {
                replacement = "";
            } else {
                replacement = "[" + (value != null ? key : written) + "]";
            }
            return Matcher.quoteReplacement(replacement);
        });
    }

    private Map<String, String> values(Lead lead, String agentName) {
        LocalDateTime now = LocalDateTime.now(zone);
        String name = lead != null && lead.getName() != null ? lead.getName().trim() : "";

        Map<String, String> values = new LinkedHashMap<>();
        values.put("nome", name);
        values.put("primeiro_nome", name.isEmpty() ? "" : name.split("\\s+")[0]);
        values.put("telefone", lead != null && !lead.isMasked() && lead.getPhone() != null
                ? PhoneUtils.formatForDisplay(lead.getPhone(), lead.getCountryCode()) : "");
        values.put("valor", lead != null ? formatCurrency(lead.getEstimatedValue()) : "");
        values.put("data", now.format(DATE));
        values.put("hora", now.format(TIME));
        values.put("data_inicio", lead != null && lead.getCreatedAt() != null
                ? lead.getCreatedAt().format(DATE) : now.format(DATE));
        String benefit = lead != null && lead.getBenefitType() != null ? lead.getBenefitType() : "";
        values.put("beneficio", benefit);
        values.put("tipo_beneficio", benefit);
        values.put("atendente", agentName != null ? agentName : "");
        values.put("cpf", lead != null ? formatCpf(lead.getDocumentNumber()) : "");
        values.put("email", lead != null && lead.getEmail() != null ? lead.getEmail() : "");
        return values;
    }

    private static String formatCurrency(BigDecimal value) {
        if (value == null) {
            return "";
        }
        return NumberFormat.getCurrencyInstance(PT_BR).format(value);
    }

    static String formatCpf(String document) {
        if (document == null || document.isBlank()) {
            return "";
        }
        String digits = document.replaceAll("\\D", "");
        if (digits.length() != 11) {
            return document;
        }
        return digits.substring(0, 3) + "." + digits.substring(3, 6) + "." + digits.substring(6, 9)
                + "-" + digits.substring(9);
    }
}
