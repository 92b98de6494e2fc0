package com.flagship.altyn_ledger.corporate;

import lombok.Value;

@Value
public class CorporateWalletCreation {
    CorporateWalletView wallet;
    boolean created;
}
