package com.coverwise.insurance.domain;

public record BankDetails(
    String accountNumber,
    String bankName,
    String ifscCode,
    String accountHolderName
) {
    public boolean isComplete() {
        return notBlank(accountNumber) && notBlank(bankName) && notBlank(ifscCode) && notBlank(accountHolderName);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
