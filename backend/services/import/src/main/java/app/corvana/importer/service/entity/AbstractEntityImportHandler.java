package app.corvana.importer.service.entity;

import app.corvana.importer.service.mapping.ColumnMappingDetector;
import app.corvana.importer.service.mapping.DetectedMapping;
import app.corvana.importer.service.mapping.FieldMapping;
import app.corvana.importer.service.mapping.MappingValidation;
import app.corvana.importer.service.parser.ParsedTable;

import java.util.ArrayList;
import java.util.List;

abstract class AbstractEntityImportHandler<C extends CandidateEntity> implements EntityImportHandler<C> {

    protected final ColumnMappingDetector detector;

    protected AbstractEntityImportHandler(ColumnMappingDetector detector) {
        this.detector = detector;
    }

    @Override
    public DetectedMapping detect(List<String> headers) {
        return detector.detect(headers, fields());
    }

    @Override
    public MappingValidation validateMapping(FieldMapping mapping, int headerCount) {
        List<String> errors = MappingValidation.baseErrors(fields(), mapping, headerCount);
        addMappingErrors(mapping, headerCount, errors);
        return new MappingValidation(errors);
    }

    @Override
    public List<C> transform(ParsedTable table, FieldMapping mapping) {
        List<C> candidates = new ArrayList<>(table.rowCount());
        for (int row = 0; row < table.rowCount(); row++) {
            candidates.add(transformRow(new RowReader(table, row, mapping), row, mapping));
        }
        return List.copyOf(candidates);
    }

    protected void addMappingErrors(FieldMapping mapping, int headerCount, List<String> errors) {
    }

    protected abstract C transformRow(RowReader row, int rowIndex, FieldMapping mapping);
}
