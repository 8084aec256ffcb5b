package com.ryuqq.dealstore.core.patch;

import com.ryuqq.dealstore.core.model.Deal;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Applies a field-name → value map to a deal through the static whitelist.
 *
 * <p>Each entry is handled independently: it is either written (and reported as an
 * {@link AppliedField}) or refused (and reported as a {@link RejectedField}). No entry is
 * ever silently dropped.</p>
 *
 * <p><strong>Rejection Reasons:</strong></p>
 * <ul>
 *   <li>DealId: "DealId is the key and cannot be patched"</li>
 *   <li>PostcodeArea, Region, MapLink, WeightedAmountGBP: "{name} is a derived field and cannot be patched directly"</li>
 *   <li>Anything else not whitelisted: "Unknown field: {name}"</li>
 *   <li>Whitelisted field with a bad value: the field parser's message, e.g.
 *       "Probability must be between 0 and 100"</li>
 * </ul>
 *
 * <p>The patcher only edits the working copy it is given. Normalizing and persisting the
 * result is the caller's job.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public class DealPatcher {

    private static final String KEY_FIELD = "dealid";
    private static final Set<String> DERIVED_FIELDS = Set.of("postcodearea", "region", "maplink", "weightedamountgbp");

    /**
     * Applies every entry of the patch to the deal.
     *
     * @param deal working copy to modify
     * @param patch field name → raw value (String, Number, Boolean, LocalDate, Collection or null)
     * @return applied and rejected fields, in the patch's iteration order
     * @throws IllegalArgumentException if deal or patch is null
     */
    public AppliedPatch apply(Deal deal, Map<String, ?> patch) {
        if (deal == null) {
            throw new IllegalArgumentException("deal cannot be null");
        }
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        List<AppliedField> applied = new ArrayList<>();
        List<RejectedField> rejected = new ArrayList<>();

        for (Map.Entry<String, ?> entry : patch.entrySet()) {
            String name = entry.getKey();
            Object raw = entry.getValue();
            String key = name == null ? "" : name.toLowerCase(Locale.ROOT);

            if (KEY_FIELD.equals(key)) {
                rejected.add(reject(name, raw, "DealId is the key and cannot be patched"));
            } else if (DERIVED_FIELDS.contains(key)) {
                rejected.add(reject(name, raw, name + " is a derived field and cannot be patched directly"));
            } else {
                PatchableField<?> field = PatchableField.lookup(name).orElse(null);
                if (field == null) {
                    rejected.add(reject(name, raw, "Unknown field: " + name));
                } else {
                    applyField(field, deal, name, raw, applied, rejected);
                }
            }
        }
        return new AppliedPatch(applied, rejected);
    }

    private static <T> void applyField(
        PatchableField<T> field,
        Deal deal,
        String requestedName,
        Object raw,
        List<AppliedField> applied,
        List<RejectedField> rejected
    ) {
        ParsedValue<T> parsed = field.parse(raw);
        if (parsed instanceof ParsedValue.Accepted<T> accepted) {
            applied.add(field.write(deal, accepted.value()));
        } else if (parsed instanceof ParsedValue.Rejected<T> refusal) {
            rejected.add(reject(requestedName, raw, refusal.reason()));
        }
    }

    private static RejectedField reject(String name, Object raw, String reason) {
        return new RejectedField(name, PatchableField.toText(raw), reason);
    }

    /**
     * Names accepted by {@link #apply}, lower-case, including aliases.
     *
     * @return whitelisted names
     */
    public static Set<String> patchableFieldNames() {
        return PatchableField.registry().keySet();
    }
}
