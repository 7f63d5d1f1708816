package ncats.planarity;

/**
 * Outcome of a {@link PlanarityCheck} that proved a component nonplanar.
 */
public class Violation {
    public final Verdict verdict;
    public final Witness witness; // null for the density bound

    public Violation (Verdict verdict) {
        this (verdict, null);
    }
    
    public Violation (Verdict verdict, Witness witness) {
        if (verdict == null || !verdict.isNonplanar())
            throw new IllegalArgumentException
                ("Not a violation: "+verdict);
        if (witness != null && witness.verdict() != verdict)
            throw new IllegalArgumentException
                ("Witness "+witness+" doesn't support "+verdict);
        this.verdict = verdict;
        this.witness = witness;
    }

    public static Violation of (Witness witness) {
        return witness != null
            ? new Violation (witness.verdict(), witness) : null;
    }
}
