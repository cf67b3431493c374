package com.questrail.synop.internal.field;

import com.questrail.synop.config.UnitConverter;
import com.questrail.synop.internal.table.CodeTable;
import com.questrail.synop.internal.table.InvalidCodeException;
import com.questrail.synop.model.Observation;

import java.util.Objects;

/**
 * A field whose code is looked up in a {@link CodeTable}. Decoded observations
 * carry the table id and the integer code as provenance.
 *
 * <p>For decode-only tables the code is taken back from that provenance, so
 * such a field can only be encoded if it was decoded from the same table.</p>
 */
public final class TableFieldCodec<T> extends AbstractFieldCodec<T>
{
    private final CodeTable<T> table;

    public TableFieldCodec(CodeTable<T> table, int width, String unit) {
        super(width, unit);
        this.table = Objects.requireNonNull(table, "table");
    }

    public TableFieldCodec(CodeTable<T> table, int width) {
        this(table, width, null);
    }

    public CodeTable<T> table() {
        return table;
    }

    @Override
    protected Observation<T> decodeAvailable(String raw) throws InvalidCodeException {
        int code = Codes.parse(raw, "code for table " + table.id());
        return Observation.coded(raw, table.decode(code), unit(), table.id(), code);
    }

    @Override
    protected String encodeAvailable(Observation<T> observation, UnitConverter units)
            throws InvalidCodeException {
        int code;
        if (table.isEncodable()) {
            code = table.encode(observation.value());
        } else if (observation.hasProvenance() && table.id().equals(observation.table())) {
            code = observation.code();
        } else {
            throw new InvalidCodeException(
                    "Code table " + table.id() + " is decode-only and the value has no code");
        }
        return Codes.pad(code, width());
    }
}
