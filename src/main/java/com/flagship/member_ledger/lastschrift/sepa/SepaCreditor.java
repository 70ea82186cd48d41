package com.flagship.member_ledger.lastschrift.sepa;

import com.flagship.member_ledger.config.FinanceProperties;
import lombok.Value;

/**
 * The collecting party as it appears in InitgPty, Cdtr, CdtrAcct and CdtrSchmeId.
 */
@Value
public class SepaCreditor {
    String name;
    String addressLine1;
    String addressLine2;
    String country;
    String iban;
    String creditorId;

    public static SepaCreditor from(FinanceProperties.Sepa sepa) {
        return new SepaCreditor(
            SepaText.asciify(sepa.getCreditorName()),
            SepaText.asciify(sepa.getAddressLine1()),
            SepaText.asciify(sepa.getAddressLine2()),
            sepa.getCountry(),
            sepa.getCreditorIban(),
            SepaText.asciify(sepa.getCreditorId())
        );
    }
}
