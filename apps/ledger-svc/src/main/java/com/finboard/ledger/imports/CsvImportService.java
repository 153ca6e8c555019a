package com.finboard.ledger.imports;

import com.finboard.ledger.error.NotFoundException;
import com.finboard.ledger.error.ValidationException;
import com.finboard.ledger.investment.InvestmentService;
import com.finboard.ledger.model.AccountType;
import com.finboard.ledger.model.ImportResult;
import com.finboard.ledger.model.TransactionType;
import com.finboard.ledger.service.AccountService;
import com.finboard.ledger.service.TransactionService;
import com.finboard.ledger.support.DateTimes;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Bulk import of transactions, accounts and holdings from CSV text. Every row is stored on its own;
 * a bad row is reported as {@code Row N: reason} and the rest of the file still imports.
 */
@Service
public class CsvImportService {

    private static final Logger log = LoggerFactory.getLogger(CsvImportService.class);

    private final CsvRowReader rowReader;
    private final TransactionService transactionService;
    private final AccountService accountService;
    private final InvestmentService investmentService;
    private final Clock clock;

    public CsvImportService(
            CsvRowReader rowReader,
            TransactionService transactionService,
            AccountService accountService,
            InvestmentService investmentService,
            Clock clock
    ) {
        this.rowReader = rowReader;
        this.transactionService = transactionService;
        this.accountService = accountService;
        this.investmentService = investmentService;
        this.clock = clock;
    }

    public static void requireCsvFilename(String filename) {
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new ValidationException("File must be a CSV");
        }
    }

    public ImportResult importTransactions(String content) {
        ZoneId zone = clock.getZone();
        return importRows("transactions", content, row -> transactionService.createTransaction(
                new TransactionService.NewTransaction(
                        row.requiredUuid("account_id"),
                        TransactionType.fromValue(row.required("type")),
                        row.requiredDecimal("amount"),
                        row.optional("category"),
                        row.optional("merchant"),
                        row.optional("description"),
                        splitTags(row.optional("tags")),
                        DateTimes.parseInstant(row.required("date"), zone)
                )));
    }

    public ImportResult importAccounts(String content) {
        return importRows("accounts", content, row -> accountService.createAccount(
                new AccountService.NewAccount(
                        row.required("name"),
                        AccountType.fromValue(row.required("account_type")),
                        row.requiredDecimal("balance"),
                        row.optional("currency"),
                        row.optional("institution"),
                        row.optional("account_number"),
                        row.optional("notes")
                )));
    }

    public ImportResult importInvestments(String content) {
        ZoneId zone = clock.getZone();
        return importRows("investments", content, row -> investmentService.importInvestment(
                new InvestmentService.NewInvestment(
                        row.requiredUuid("account_id"),
                        row.required("symbol"),
                        row.optional("name"),
                        row.required("asset_type"),
                        row.optional("exchange"),
                        row.requiredDecimal("quantity"),
                        row.requiredDecimal("purchase_price"),
                        row.optional("currency"),
                        DateTimes.parseInstant(row.optional("purchase_date"), zone)
                )));
    }

    private ImportResult importRows(String kind, String content, Consumer<CsvRow> importer) {
        List<CsvRow> rows = rowReader.read(content);
        List<String> errors = new ArrayList<>();
        int imported = 0;
        for (CsvRow row : rows) {
            try {
                importer.accept(row);
                imported++;
            } catch (ValidationException | NotFoundException | IllegalArgumentException ex) {
                errors.add("Row " + row.number() + ": " + ex.getMessage());
            }
        }
        if (errors.isEmpty()) {
            log.info("Imported {} {} rows", imported, kind);
        } else {
            log.warn("Imported {} of {} {} rows; {} rejected", imported, rows.size(), kind, errors.size());
        }
        return new ImportResult(imported, errors, rows.size());
    }

    private static List<String> splitTags(String tags) {
        if (tags == null) {
            return List.of();
        }
        return Arrays.stream(tags.split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .toList();
    }
}
