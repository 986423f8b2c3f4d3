package org.chargenet.oracle;

/**
 * Gate consulted before a batch of billable oracle calls is made.
 */
@FunctionalInterface
public interface BatchConfirmation {

    /**
     * @param callCount number of oracle calls about to be made.
     * @return {@code true} to proceed.
     */
    boolean confirm(int callCount);

    /**
     * Gate that always proceeds.
     */
    static BatchConfirmation always() {
        return callCount -> true;
    }
}
