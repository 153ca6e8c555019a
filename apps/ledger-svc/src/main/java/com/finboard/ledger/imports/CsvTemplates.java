package com.finboard.ledger.imports;

import com.finboard.ledger.error.NotFoundException;
import java.util.Locale;

/**
 * Sample upload files, one per import kind.
 */
public final class CsvTemplates {

    static final String SAMPLE_ACCOUNT_ID = "3f1c2a9e-5b7d-4c21-9a0e-6d8f4b2c1e70";
    static final String SAMPLE_BROKERAGE_ID = "8a4e6c1d-2f3b-4d5e-8c9a-1b2c3d4e5f60";

    static final String TRANSACTIONS = """
            date,amount,type,category,merchant,description,account_id,tags
            2024-01-01,100.00,income,Salary,Employer,Monthly salary,%1$s,
            2024-01-02,50.00,expense,Groceries,Walmart,Weekly groceries,%1$s,food,essential
            2024-01-03,30.00,expense,Transportation,Uber,Ride to work,%1$s,transport
            """.formatted(SAMPLE_ACCOUNT_ID);

    static final String ACCOUNTS = """
            name,account_type,balance,currency,institution,account_number,notes
            Checking Account,checking,5000.00,USD,Chase Bank,****1234,Primary account
            Savings Account,savings,10000.00,USD,Chase Bank,****5678,Emergency fund
            Credit Card,credit_card,-1500.00,USD,Amex,****9012,Main credit card
            """;

    static final String INVESTMENTS = """
            symbol,name,asset_type,exchange,quantity,purchase_price,purchase_date,account_id,currency
            AAPL,Apple Inc,stock,US,10,150.00,2024-01-01,%1$s,USD
            RELIANCE,Reliance Industries,stock,NSE,50,2500.00,2024-01-01,%1$s,INR
            NIFTY,Nifty 50 ETF,etf,NSE,100,180.00,2024-01-01,%1$s,INR
            """.formatted(SAMPLE_BROKERAGE_ID);

    private CsvTemplates() {
    }

    public static String forKind(String kind) {
        return switch (kind == null ? "" : kind.toLowerCase(Locale.ROOT)) {
            case "transactions" -> TRANSACTIONS;
            case "accounts" -> ACCOUNTS;
            case "investments" -> INVESTMENTS;
            default -> throw NotFoundException.of("Template");
        };
    }
}
