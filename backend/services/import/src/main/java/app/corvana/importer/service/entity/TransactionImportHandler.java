package app.corvana.importer.service.entity;

import app.corvana.importer.service.mapping.CanonicalField;
import app.corvana.importer.service.mapping.ColumnMappingDetector;
import app.corvana.importer.service.mapping.FieldMapping;
import app.corvana.importer.service.support.ImportValues;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Component
public class TransactionImportHandler extends AbstractEntityImportHandler<TransactionCandidate> {

    private static final List<CanonicalField> FIELDS = List.of(
            CanonicalField.required("date", "Date",
                    "date", "transaction date", "posted date", "posting date", "trans date", "booking date", "value date"),
            CanonicalField.optional("amount", "Amount",
                    "amount", "transaction amount", "amt", "value", "sum", "total"),
            CanonicalField.required("description", "Description",
                    "description", "memo", "payee", "merchant", "details", "narrative", "transaction description", "name"),
            CanonicalField.optional("notes", "Notes",
                    "notes", "note", "memo", "comment", "comments"),
            CanonicalField.optional("debit", "Debit",
                    "debit", "withdrawal", "withdrawals", "money out", "debit amount", "paid out"),
            CanonicalField.optional("credit", "Credit",
                    "credit", "deposit", "deposits", "money in", "credit amount", "paid in")
    );

    public TransactionImportHandler(ColumnMappingDetector detector) {
        super(detector);
    }

    @Override
    public EntityType type() {
        return EntityType.transaction;
    }

    @Override
    public List<CanonicalField> fields() {
        return FIELDS;
    }

    @Override
    protected void addMappingErrors(FieldMapping mapping, int headerCount, List<String> errors) {
        if (!mapping.isMapped("amount") && !mapping.isMapped("debit") && !mapping.isMapped("credit")) {
            errors.add("Amount column (or Debit/Credit columns) is required");
        }
    }

    @Override
    protected TransactionCandidate transformRow(RowReader row, int rowIndex, FieldMapping mapping) {
        List<String> errors = new ArrayList<>();

        LocalDate date = null;
        String rawDate = row.text("date");
        if (rawDate == null) {
            errors.add("Date is required");
        } else {
            date = ImportValues.parseDate(rawDate);
            if (date == null) {
                errors.add("Invalid date: '" + rawDate + "'");
            }
        }

        String description = row.required("description", "Description", errors);
        BigDecimal amount = resolveAmount(row, errors);

        return new TransactionCandidate(rowIndex, date, amount, description, row.text("notes"),
                errors.isEmpty(), errors);
    }

    private BigDecimal resolveAmount(RowReader row, List<String> errors) {
        String rawAmount = row.text("amount");
        if (rawAmount != null) {
            BigDecimal amount = ImportValues.parseAmount(rawAmount);
            if (amount == null) {
                errors.add("Invalid amount: '" + rawAmount + "'");
            }
            return amount;
        }

        String rawDebit = row.text("debit");
        String rawCredit = row.text("credit");
        if (rawDebit == null && rawCredit == null) {
            errors.add("Amount is required");
            return null;
        }
        BigDecimal debit = parseSide(rawDebit, errors);
        BigDecimal credit = parseSide(rawCredit, errors);
        if (debit == null && credit == null) {
            return null;
        }
        boolean hasDebit = debit != null && debit.signum() != 0;
        boolean hasCredit = credit != null && credit.signum() != 0;
        if (hasDebit && hasCredit) {
            errors.add("Ambiguous amount: both debit and credit are set");
            return null;
        }
        if (hasDebit) {
            return debit.abs().negate();
        }
        if (hasCredit) {
            return credit.abs();
        }
        return BigDecimal.ZERO;
    }

    private BigDecimal parseSide(String raw, List<String> errors) {
        if (raw == null) {
            return null;
        }
        BigDecimal value = ImportValues.parseAmount(raw);
        if (value == null) {
            errors.add("Invalid amount: '" + raw + "'");
        }
        return value;
    }
}
