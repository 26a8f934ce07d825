package org.broadinstitute.methseg.exceptions;

/**
 * <p/>
 * Class MethSegException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class MethSegException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public MethSegException( String msg ) {
        super(msg);
    }

    public MethSegException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of MethSegException for common kinds of errors
     */

    /**
     * <p/>
     * Raised when the segmental forward and backward passes stop agreeing with each other or
     * produce non-finite probabilities. It always signals a defect in the recursions, never a property of the data.
     */
    public static class NumericDivergence extends MethSegException {
        private static final long serialVersionUID = 0L;

        public NumericDivergence( final String message ) {
            super(String.format("Numeric divergence in the segmental forward-backward algorithm: %s", message));
        }

        public NumericDivergence( final int start, final int end, final double forwardTotal, final double backwardTotal ) {
            this(String.format("forward (%s) and backward (%s) log-likelihoods of the subsequence [%d, %d) disagree",
                    forwardTotal, backwardTotal, start, end));
        }
    }
}
