package com.cropcopilot.advisor.service.compliance;

import com.cropcopilot.advisor.configuration.AppProperties;
import com.cropcopilot.advisor.configuration.ComplianceProperties;
import com.cropcopilot.advisor.model.compliance.CheckSeverity;
import com.cropcopilot.advisor.model.compliance.ComplianceCheckResult;
import com.cropcopilot.advisor.model.compliance.ComplianceEvaluation;
import com.cropcopilot.advisor.model.compliance.ComplianceInput;
import com.cropcopilot.advisor.model.compliance.PlannedProduct;
import com.cropcopilot.advisor.model.compliance.RiskReviewDecision;
import com.cropcopilot.advisor.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Runs the fixed battery of label-context checks over a finished product plan.
 *
 * <p>Pure: the result depends only on the input, the configured thresholds and
 * the supplied instant, so re-evaluating the same plan yields the same checks.
 * Missing data never fails a check; it yields {@code needs_manual_verification}.
 */
@Component
@RequiredArgsConstructor
public class ComplianceRiskEvaluator {

    static final String REGISTRATION_JURISDICTION = "registration_jurisdiction";
    static final String CROP_STAGE_USE_SITE = "crop_stage_use_site";
    static final String REI_PHI_WINDOW = "rei_phi_window";
    static final String MAX_SINGLE_RATE = "max_single_rate";
    static final String MAX_SEASONAL_DOSE = "max_seasonal_dose";
    static final String ENDANGERED_SPECIES_BULLETIN = "endangered_species_bulletin";

    private static final Pattern RATE_NUMBER = Pattern.compile("[-+]?\\d*\\.?\\d+");

    private static final Pattern US_MARKER = Pattern.compile(
            "(?<![a-z])(us|usa|u\\.s\\.(a\\.?)?|united states(?: of america)?)(?![a-z])");

    /**
     * Final comma-separated segment holding a two-letter code, optionally followed by a ZIP.
     */
    private static final Pattern STATE_CODE_SEGMENT = Pattern.compile("([A-Z]{2})(?:\\s+\\d{5}(?:-\\d{4})?)?");

    private static final Set<String> CANADIAN_PROVINCE_CODES = Set.of(
            "AB", "BC", "MB", "NB", "NL", "NS", "NT", "NU", "ON", "PE", "QC", "SK", "YT");

    private static final Set<String> US_STATE_NAMES = Set.of(
            "alabama", "alaska", "arizona", "arkansas", "california", "colorado", "connecticut",
            "delaware", "florida", "georgia", "hawaii", "idaho", "illinois", "indiana", "iowa",
            "kansas", "kentucky", "louisiana", "maine", "maryland", "massachusetts", "michigan",
            "minnesota", "mississippi", "missouri", "montana", "nebraska", "nevada", "new hampshire",
            "new jersey", "new mexico", "new york", "north carolina", "north dakota", "ohio",
            "oklahoma", "oregon", "pennsylvania", "rhode island", "south carolina", "south dakota",
            "tennessee", "texas", "utah", "vermont", "virginia", "washington", "west virginia",
            "wisconsin", "wyoming");

    private static final Set<String> US_STATE_CODES = Set.of(
            "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "FL", "GA", "HI", "ID", "IL", "IN", "IA",
            "KS", "KY", "LA", "ME", "MD", "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV", "NH", "NJ",
            "NM", "NY", "NC", "ND", "OH", "OK", "OR", "PA", "RI", "SC", "SD", "TN", "TX", "UT", "VT",
            "VA", "WA", "WV", "WI", "WY");

    private final AppProperties props;

    public ComplianceEvaluation evaluate(ComplianceInput input, Instant now) {
        ComplianceProperties policy = props.getCompliance();

        List<ComplianceCheckResult> checks = new ArrayList<>();
        checks.add(registrationJurisdiction(input, policy));
        checks.add(cropStageUseSite(input, policy));
        checks.add(reiPhiWindow(input, policy, now));

        List<ParsedRate> rates = parseRates(input.getProducts());
        OptionalDouble maxRate = rates.stream().mapToDouble(ParsedRate::getRate).max();
        checks.add(maxSingleRate(rates, maxRate, policy));
        checks.add(maxSeasonalDose(input.getFieldAcreage(), rates, maxRate, policy));
        checks.add(endangeredSpeciesBulletin(input, policy));

        RiskReviewDecision riskReview = RiskReviewDecision.mostSevere(
                checks.stream().map(ComplianceCheckResult::getResult).collect(Collectors.toList()));
        return new ComplianceEvaluation(List.copyOf(checks), riskReview);
    }

    private ComplianceCheckResult registrationJurisdiction(ComplianceInput input, ComplianceProperties policy) {
        Optional<String> location = TextNormalizer.nonBlank(input.getLocation());
        return check(policy, REGISTRATION_JURISDICTION, "Registration & Jurisdiction Context", CheckSeverity.HARD)
                .result(location.isPresent() ? RiskReviewDecision.CLEAR_SIGNAL : RiskReviewDecision.NEEDS_MANUAL_VERIFICATION)
                .message(location
                        .map(value -> String.format("Location context provided (%s).", value))
                        .orElse("Location missing. Confirm local registration rules before application."))
                .evidence(ComplianceCheckResult.evidence("location", input.getLocation()))
                .build();
    }

    private ComplianceCheckResult cropStageUseSite(ComplianceInput input, ComplianceProperties policy) {
        Optional<String> crop = TextNormalizer.nonBlank(input.getCrop());
        Optional<String> stage = TextNormalizer.nonBlank(input.getSeason());
        boolean complete = crop.isPresent() && stage.isPresent();
        return check(policy, CROP_STAGE_USE_SITE, "Crop Stage & Use Site Context", CheckSeverity.HARD)
                .result(complete ? RiskReviewDecision.CLEAR_SIGNAL : RiskReviewDecision.NEEDS_MANUAL_VERIFICATION)
                .message(complete
                        ? String.format("Crop (%s) and stage (%s) provided.", crop.get(), stage.get())
                        : "Crop or growth stage missing. Confirm label stage restrictions manually.")
                .evidence(ComplianceCheckResult.evidence("crop", input.getCrop(), "season", input.getSeason()))
                .build();
    }

    private ComplianceCheckResult reiPhiWindow(ComplianceInput input, ComplianceProperties policy, Instant now) {
        LocalDate planned = input.getPlannedApplicationDate();
        ComplianceCheckResult.ComplianceCheckResultBuilder builder =
                check(policy, REI_PHI_WINDOW, "REI/PHI Timing Context", CheckSeverity.HARD)
                        .evidence(ComplianceCheckResult.evidence(
                                "plannedApplicationDate", planned == null ? null : planned.toString()));

        if (planned == null) {
            return builder.result(RiskReviewDecision.NEEDS_MANUAL_VERIFICATION)
                    .message("Planned application date missing. REI/PHI timing requires manual verification.")
                    .build();
        }

        Instant plannedStart = planned.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant cutoff = now.minus(Duration.ofHours(policy.getPastDateGraceHours()));
        if (plannedStart.isBefore(cutoff)) {
            return builder.result(RiskReviewDecision.POTENTIAL_CONFLICT)
                    .message("Planned date is in the past. Re-check timing constraints before application.")
                    .build();
        }
        return builder.result(RiskReviewDecision.CLEAR_SIGNAL)
                .message("Planned date is available for REI/PHI timing review.")
                .build();
    }

    private ComplianceCheckResult maxSingleRate(List<ParsedRate> rates, OptionalDouble maxRate,
                                                ComplianceProperties policy) {
        ComplianceCheckResult.ComplianceCheckResultBuilder builder =
                check(policy, MAX_SINGLE_RATE, "Single Application Rate Context", CheckSeverity.HARD)
                        .evidence(ComplianceCheckResult.evidence(
                                "maxRate", maxRate.isPresent() ? maxRate.getAsDouble() : null,
                                "parsedRates", rates.stream().map(ParsedRate::toEvidence).collect(Collectors.toList())));

        if (maxRate.isEmpty()) {
            return builder.result(RiskReviewDecision.NEEDS_MANUAL_VERIFICATION)
                    .message("One or more rates are missing or non-numeric. Manual rate validation required.")
                    .build();
        }
        if (maxRate.getAsDouble() > policy.getMaxSingleRate()) {
            return builder.result(RiskReviewDecision.POTENTIAL_CONFLICT)
                    .message(String.format("One product rate appears high (%s). Check label max rate before application.",
                            formatNumber(maxRate.getAsDouble())))
                    .build();
        }
        return builder.result(RiskReviewDecision.CLEAR_SIGNAL)
                .message("Rates appear within conservative planning thresholds.")
                .build();
    }

    private ComplianceCheckResult maxSeasonalDose(Double acreage, List<ParsedRate> rates, OptionalDouble maxRate,
                                                  ComplianceProperties policy) {
        boolean computable = acreage != null && acreage > 0 && maxRate.isPresent();
        Double totalDose = computable
                ? rates.stream().mapToDouble(rate -> rate.getRate() * acreage).sum()
                : null;

        ComplianceCheckResult.ComplianceCheckResultBuilder builder =
                check(policy, MAX_SEASONAL_DOSE, "Seasonal Dose Context", CheckSeverity.SOFT)
                        .evidence(ComplianceCheckResult.evidence("acreage", acreage, "totalDose", totalDose));

        if (!computable) {
            return builder.result(RiskReviewDecision.NEEDS_MANUAL_VERIFICATION)
                    .message("Acreage or numeric rates missing. Seasonal total requires manual verification.")
                    .build();
        }
        if (totalDose > policy.getMaxSeasonalDose()) {
            return builder.result(RiskReviewDecision.POTENTIAL_CONFLICT)
                    .message("Estimated seasonal total looks high. Confirm cumulative label maximums.")
                    .build();
        }
        return builder.result(RiskReviewDecision.CLEAR_SIGNAL)
                .message("Estimated seasonal total appears within conservative planning thresholds.")
                .build();
    }

    private ComplianceCheckResult endangeredSpeciesBulletin(ComplianceInput input, ComplianceProperties policy) {
        boolean us = isLikelyUsLocation(input.getLocation());
        return check(policy, ENDANGERED_SPECIES_BULLETIN, "Endangered Species Bulletin Context", CheckSeverity.SOFT)
                .result(us ? RiskReviewDecision.NEEDS_MANUAL_VERIFICATION : RiskReviewDecision.CLEAR_SIGNAL)
                .message(us
                        ? "US location detected. Confirm Bulletin Live! requirements before application."
                        : "No US jurisdiction detected for BLT context check.")
                .evidence(ComplianceCheckResult.evidence("location", input.getLocation()))
                .build();
    }

    private static ComplianceCheckResult.ComplianceCheckResultBuilder check(ComplianceProperties policy, String id,
                                                                           String title, CheckSeverity severity) {
        return ComplianceCheckResult.builder()
                .id(id)
                .title(title)
                .severity(severity)
                .ruleVersion(policy.getRuleVersion())
                .sourceVersion(policy.getSourceVersion());
    }

    /**
     * First numeric token of a free-text rate such as "15 oz/acre"; empty
     * when there is none.
     */
    static OptionalDouble parseRate(String rate) {
        if (rate == null) {
            return OptionalDouble.empty();
        }
        Matcher matcher = RATE_NUMBER.matcher(rate);
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }
        try {
            double value = Double.parseDouble(matcher.group());
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    static boolean isLikelyUsLocation(String location) {
        if (location == null || location.isBlank()) {
            return false;
        }
        String lower = location.toLowerCase(Locale.ROOT);
        if (US_MARKER.matcher(lower).find()) {
            return true;
        }
        for (String state : US_STATE_NAMES) {
            if (Pattern.compile("\\b" + Pattern.quote(state) + "\\b").matcher(lower).find()) {
                return true;
            }
        }
        return endsWithStateCode(location);
    }

    /**
     * "Ames, IA" counts; "Guelph, ON, CA" does not, since CA there follows a province.
     */
    private static boolean endsWithStateCode(String location) {
        String[] segments = location.split(",");
        if (segments.length < 2) {
            return false;
        }
        Matcher code = STATE_CODE_SEGMENT.matcher(segments[segments.length - 1].trim());
        if (!code.matches() || !US_STATE_CODES.contains(code.group(1))) {
            return false;
        }
        return !CANADIAN_PROVINCE_CODES.contains(segments[segments.length - 2].trim());
    }

    private static List<ParsedRate> parseRates(List<PlannedProduct> products) {
        List<ParsedRate> parsed = new ArrayList<>();
        for (PlannedProduct product : products) {
            OptionalDouble rate = parseRate(product.getApplicationRate());
            if (rate.isPresent()) {
                parsed.add(new ParsedRate(product.getProductId(), product.getProductName(), rate.getAsDouble()));
            }
        }
        return parsed;
    }

    private static String formatNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Value
    private static class ParsedRate {
        String productId;
        String productName;
        double rate;

        Map<String, Object> toEvidence() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("productId", productId);
            map.put("productName", productName);
            map.put("rate", rate);
            return map;
        }
    }
}
