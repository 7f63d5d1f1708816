package ncats.planarity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per component outcome of the planarity checks. Note that there is no
 * "planar" verdict; POSSIBLY_PLANAR only means none of the checks found
 * a violation.
 */
public enum Verdict {
    BOUND_VIOLATION ("nonplanar (bound-violation)"),
    K5_FOUND ("nonplanar (K5 found)"),
    K33_FOUND ("nonplanar (K3,3 found)"),
    POSSIBLY_PLANAR ("possibly-planar");

    final String tag;
    Verdict (String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag () { return tag; }
    
    public boolean isNonplanar () { return this != POSSIBLY_PLANAR; }
}
