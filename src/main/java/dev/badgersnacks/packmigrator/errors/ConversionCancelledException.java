package dev.badgersnacks.packmigrator.errors;

import java.util.List;

public class ConversionCancelledException extends ConversionException {

    public ConversionCancelledException(String phase) {
        super("Conversion cancelled during " + phase, List.of());
    }
}
