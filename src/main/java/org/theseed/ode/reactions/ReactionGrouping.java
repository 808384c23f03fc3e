/**
 *
 */
package org.theseed.ode.reactions;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.model.Term;

/**
 * This object finds the best way to split the terms sharing a single monomial into
 * reactions.  Every partition of the terms is considered, using restricted-growth strings
 * with pruning:  a partial block that already breaks the stoichiometry limits cannot be
 * fixed by adding terms, and a partial partition with more blocks than the best found so
 * far cannot win.
 *
 * The best partition has the fewest blocks.  Among partitions with the same number of
 * blocks, the one whose block starting positions are lexicographically earliest wins.  If
 * two partitions tie on both counts the grouping is ambiguous.
 */
public class ReactionGrouping {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ReactionGrouping.class);
    /** monomial key shared by the terms */
    private final String key;
    /** terms to group, in source order */
    private final List<Entry> entries;
    /** maximum total reactant stoichiometry */
    private final int maxReactants;
    /** maximum total product stoichiometry */
    private final int maxProducts;
    /** maximum stoichiometry for a single species */
    private final int maxStoich;
    /** current partial partition */
    private List<List<Integer>> blocks;
    /** best partition found */
    private List<List<Integer>> best;
    /** TRUE if another partition ties the best one */
    private boolean tied;

    /** maximum number of terms that can share a monomial */
    public static final int MAX_ENTRIES = 10;
    /** relative tolerance for an integral stoichiometry */
    private static final double TOLERANCE = 1e-9;

    /**
     * This class represents a single term of a species' derivative.
     */
    public static class Entry {

        /** species whose derivative contains the term */
        private final String species;
        /** state-vector index of the species */
        private final int index;
        /** the term itself */
        private final Term term;
        /** position of the term in the model, counting across all derivatives */
        private final int order;
        /** sign of the term's parameter factors, 1 or -1 */
        private final int sign;

        /**
         * Create a term entry.
         *
         * @param species	species whose derivative contains the term
         * @param index		state-vector index of the species
         * @param term		the term itself
         * @param order		position of the term in the model
         */
        public Entry(String species, int index, Term term, int order) {
            this(species, index, term, order, 1);
        }

        /**
         * Create a term entry whose parameter factors have a known sign.
         *
         * @param species	species whose derivative contains the term
         * @param index		state-vector index of the species
         * @param term		the term itself
         * @param order		position of the term in the model
         * @param sign		-1 if the parameter factors multiply to a negative value, else 1
         */
        public Entry(String species, int index, Term term, int order, int sign) {
            this.species = species;
            this.index = index;
            this.term = term;
            this.order = order;
            this.sign = (sign < 0 ? -1 : 1);
        }

        /**
         * @return the species whose derivative contains the term
         */
        public String getSpecies() {
            return this.species;
        }

        /**
         * @return the state-vector index of the species
         */
        public int getIndex() {
            return this.index;
        }

        /**
         * @return the term
         */
        public Term getTerm() {
            return this.term;
        }

        /**
         * @return the position of the term in the model
         */
        public int getOrder() {
            return this.order;
        }

        /**
         * @return -1 if the term's parameter factors multiply to a negative value, else 1
         */
        public int getSign() {
            return this.sign;
        }

        /**
         * @return TRUE if the term consumes its species
         */
        public boolean isReactant() {
            return this.term.getCoefficient() * this.sign < 0;
        }

        /**
         * @return the absolute value of the term's coefficient
         */
        protected double getMagnitude() {
            return Math.abs(this.term.getCoefficient());
        }

    }

    /**
     * Create a grouping problem.
     *
     * @param key			monomial key shared by the terms
     * @param entries		terms to group, in source order
     * @param maxReactants	maximum total reactant stoichiometry
     * @param maxProducts	maximum total product stoichiometry
     * @param maxStoich		maximum stoichiometry of a single species
     */
    public ReactionGrouping(String key, List<Entry> entries, int maxReactants, int maxProducts, int maxStoich) {
        this.key = key;
        this.entries = entries;
        this.maxReactants = maxReactants;
        this.maxProducts = maxProducts;
        this.maxStoich = maxStoich;
    }

    /**
     * @return the reactions for the terms, in source order, with temporary IDs
     *
     * @throws InferenceException
     */
    public List<InferredReaction> solve() throws InferenceException {
        final int m = this.entries.size();
        if (m > MAX_ENTRIES)
            throw new InferenceException(InferenceException.Kind.SEARCH_LIMIT,
                    m + " terms share the monomial " + this.key + "; the limit is " + MAX_ENTRIES + ".");
        this.blocks = new ArrayList<List<Integer>>();
        this.best = null;
        this.tied = false;
        this.search(0);
        if (this.tied)
            throw new InferenceException(InferenceException.Kind.AMBIGUOUS_GROUPING,
                    "The terms with monomial " + this.key + " can be grouped into "
                    + this.best.size() + " reactions in more than one way.");
        log.debug("Monomial {}: {} terms grouped into {} reactions.", this.key, m, this.best.size());
        List<InferredReaction> retVal = new ArrayList<InferredReaction>(this.best.size());
        for (List<Integer> block : this.best)
            retVal.add(this.buildReaction(block));
        return retVal;
    }

    /**
     * Place an entry into every possible block and continue the search.
     *
     * @param i		index of the entry to place
     */
    private void search(int i) {
        if (i >= this.entries.size())
            this.evaluate();
        else {
            // Try each existing block.
            for (int b = 0; b < this.blocks.size(); b++) {
                List<Integer> block = this.blocks.get(b);
                block.add(i);
                if (this.unit(block) > 0)
                    this.search(i + 1);
                block.remove(block.size() - 1);
            }
            // Try a new block, if that can still tie the best.
            if (this.best == null || this.blocks.size() < this.best.size()) {
                List<Integer> block = new ArrayList<Integer>(this.entries.size());
                block.add(i);
                if (this.unit(block) > 0) {
                    this.blocks.add(block);
                    this.search(i + 1);
                    this.blocks.remove(this.blocks.size() - 1);
                }
            }
        }
    }

    /**
     * Compare the current complete partition to the best one.
     */
    private void evaluate() {
        int cmp;
        if (this.best == null)
            cmp = -1;
        else {
            cmp = this.blocks.size() - this.best.size();
            for (int b = 0; cmp == 0 && b < this.blocks.size(); b++)
                cmp = this.blocks.get(b).get(0) - this.best.get(b).get(0);
        }
        if (cmp < 0) {
            this.best = new ArrayList<List<Integer>>(this.blocks.size());
            for (List<Integer> block : this.blocks)
                this.best.add(new ArrayList<Integer>(block));
            this.tied = false;
        } else if (cmp == 0)
            this.tied = true;
    }

    /**
     * @return the common rate unit for a block, or 0 if the block is not a valid reaction
     *
     * The unit is the smallest coefficient divided by a small integer, and every
     * coefficient must be an integral multiple of it within the stoichiometry limits.
     *
     * @param block		indices of the entries in the block
     */
    private double unit(List<Integer> block) {
        double min = Double.MAX_VALUE;
        for (int i : block)
            min = Math.min(min, this.entries.get(i).getMagnitude());
        double retVal = 0.0;
        for (int d = 1; retVal == 0.0 && d <= this.maxStoich; d++) {
            double u = min / d;
            int reactants = 0;
            int products = 0;
            boolean ok = true;
            for (int k = 0; ok && k < block.size(); k++) {
                Entry entry = this.entries.get(block.get(k));
                int s = stoich(entry.getMagnitude(), u);
                if (s < 1 || s > this.maxStoich)
                    ok = false;
                else if (entry.isReactant())
                    reactants += s;
                else
                    products += s;
            }
            if (ok && reactants <= this.maxReactants && products <= this.maxProducts)
                retVal = u;
        }
        return retVal;
    }

    /**
     * @return the integral stoichiometry for a coefficient, or 0 if it is not a whole multiple of the unit
     *
     * @param magnitude		absolute value of the coefficient
     * @param u				rate unit
     */
    private static int stoich(double magnitude, double u) {
        double s = magnitude / u;
        double r = Math.rint(s);
        return (Math.abs(s - r) <= TOLERANCE * s ? (int) r : 0);
    }

    /**
     * @return the reaction for a block of entries
     *
     * @param block		indices of the entries in the block
     */
    private InferredReaction buildReaction(List<Integer> block) {
        double u = this.unit(block);
        List<InferredReaction.Stoich> stoichs = new ArrayList<InferredReaction.Stoich>(block.size());
        for (int i : block) {
            Entry entry = this.entries.get(i);
            int s = stoich(entry.getMagnitude(), u);
            if (entry.isReactant())
                s = -s;
            stoichs.add(new InferredReaction.Stoich(s, entry.getSpecies(), entry.getIndex()));
        }
        Entry first = this.entries.get(block.get(0));
        // The rate carries the sign of the parameters, so it is positive when they are.
        Term rate = first.getTerm().withCoefficient(u * first.getSign());
        return new InferredReaction(this.key, stoichs, rate, first.getOrder());
    }

}
