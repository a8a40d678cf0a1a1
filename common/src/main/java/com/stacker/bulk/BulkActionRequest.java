package com.stacker.bulk;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Selects the documents a bulk action applies to, either by {@code search} or by {@code id_list},
 * optionally narrowed by {@code exclude} and a {@code group} window, plus the action's own
 * arguments ({@code archive}, {@code tags}, prospect flags).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkActionRequest implements Serializable {

    private static final long serialVersionUID = 1L;

    @Pattern(regexp = "property|prospect", message = "must be property or prospect")
    private String type;

    @Valid
    private BulkSearch search;

    /** {@code [start_id, size]}: the {@code size} ids starting at {@code start_id}. */
    @Size(min = 2, max = 2)
    private List<@Min(1) Integer> group;

    @JsonProperty("id_list")
    private List<@Min(1) Integer> idList;

    private List<@Min(1) Integer> exclude;

    private Boolean archive;

    private List<@Min(0) Integer> tags;

    // ── Prospect flags ───────────────────────────────────────────────────

    @JsonProperty("is_blocked")
    private Boolean isBlocked;

    @JsonProperty("do_not_call")
    private Boolean doNotCall;

    @JsonProperty("is_priority")
    private Boolean isPriority;

    @JsonProperty("is_qualified_lead")
    private Boolean isQualifiedLead;

    @JsonProperty("wrong_number")
    private Boolean wrongNumber;

    @JsonProperty("opted_out")
    private Boolean optedOut;

    /**
     * The prospect flags that were set, keyed by document field.
     */
    public Map<String, Boolean> flags() {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        putIfSet(flags, "is_blocked", isBlocked);
        putIfSet(flags, "do_not_call", doNotCall);
        putIfSet(flags, "is_priority", isPriority);
        putIfSet(flags, "is_qualified_lead", isQualifiedLead);
        putIfSet(flags, "wrong_number", wrongNumber);
        putIfSet(flags, "opted_out", optedOut);
        return flags;
    }

    private static void putIfSet(Map<String, Boolean> flags, String field, Boolean value) {
        if (value != null) {
            flags.put(field, value);
        }
    }
}
