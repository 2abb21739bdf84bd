package com.flagship.wallet_ledger.ledger;

/**
 * Kind of value movement. TOPUP and BONUS issue value from the treasury to a
 * user; SPEND returns it from the user to the treasury.
 */
public enum TransactionType {

    TOPUP("Top-up", "Top-up purchase"),
    BONUS("Bonus", "Bonus/incentive credit"),
    SPEND("Spend", "In-app purchase");

    private final String label;
    private final String defaultEntryDescription;

    TransactionType(String label, String defaultEntryDescription) {
        this.label = label;
        this.defaultEntryDescription = defaultEntryDescription;
    }

    /**
     * True when the treasury is debited and the user credited.
     */
    public boolean issuesValue() {
        return this != SPEND;
    }

    /**
     * e.g. "Top-up of 100.0000 credits"
     */
    public String defaultTransactionDescription(String amount) {
        return String.format("%s of %s credits", label, amount);
    }

    public String defaultEntryDescription() {
        return defaultEntryDescription;
    }
}
