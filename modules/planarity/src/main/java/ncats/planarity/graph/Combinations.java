package ncats.planarity.graph;

/**
 * Enumerate all k-subsets of {0, ..., n-1} in lexicographic order. The
 * order is the same as k nested loops i1 < i2 < ... < ik, which is what
 * makes "first combination found" reproducible.
 */
public class Combinations {
    private final int n, k;
    private int maxsize = 0;
    private long size = 0l;

    public Combinations (int n, int k) {
        if (n < 0 || k < 0)
            throw new IllegalArgumentException
                ("Bogus combination size: n="+n+" k="+k);
        this.n = n;
        this.k = k;
    }

    /*
     * returns true if the enumeration ran to completion, false if it was
     * stopped by the visitor or by the max size
     */
    public boolean generate (CombinationVisitor visitor) {
        size = 0l;
        if (visitor == null || k > n)
            return true;

        int[] c = new int[k];
        for (int i = 0; i < k; ++i)
            c[i] = i;

        for (;;) {
            ++size;
            if (!visitor.combination(c))
                return false;
            if (maxsize > 0 && size >= maxsize)
                return false;

            // rightmost position that can still be advanced
            int i = k - 1;
            while (i >= 0 && c[i] == n - k + i)
                --i;
            if (i < 0)
                break;

            ++c[i];
            for (int j = i + 1; j < k; ++j)
                c[j] = c[j-1] + 1;
        }
        return true;
    }

    public void setMaxSize (int maxsize) {
        this.maxsize = maxsize;
    }
    public int getMaxSize () { return maxsize; }

    /*
     * number of combinations visited by the last call to generate
     */
    public long size () { return size; }

    /*
     * binomial coefficient C(n,k); throws ArithmeticException if it
     * doesn't fit in a long
     */
    public static long count (int n, int k) {
        if (n < 0 || k < 0)
            throw new IllegalArgumentException
                ("Bogus combination size: n="+n+" k="+k);
        if (k > n)
            return 0l;
        k = Math.min(k, n - k);
        // c = C(n-k+i, i) after step i; dividing out gcd(c, i) first
        // keeps every product no larger than the next value of c
        long c = 1l;
        for (int i = 1; i <= k; ++i) {
            long g = gcd (c, i);
            c = Math.multiplyExact(c / g, (n - k + i) / (i / g));
        }
        return c;
    }

    static long gcd (long a, long b) {
        while (b != 0l) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
