package org.dxworks.scoreframe;

import org.dxworks.scoreframe.convert.ConversionContext;
import org.dxworks.scoreframe.convert.ConversionException;
import org.dxworks.scoreframe.convert.ConversionResult;
import org.dxworks.scoreframe.lilypond.exporter.LilyPondExporter;
import org.dxworks.scoreframe.lilypond.importer.ImportedScore;
import org.dxworks.scoreframe.lilypond.importer.LilyPondImporter;
import org.dxworks.scoreframe.lilypond.model.LilyPondFile;
import org.dxworks.scoreframe.lilypond.parser.LilyPondParser;
import org.dxworks.scoreframe.lilypond.parser.ParseException;
import org.dxworks.scoreframe.mei.MeiDocument;
import org.dxworks.scoreframe.mei.MeiValidator;
import org.dxworks.scoreframe.mei.ValidationResult;
import org.dxworks.scoreframe.musicxml.export.PartListExporter;
import org.dxworks.scoreframe.musicxml.model.PartList;

/**
 * Entry point for library use. Every call runs on its own {@link ConversionContext}, so one converter
 * can serve concurrent callers.
 */
public class ScoreConverter {

    private final ScoreframeConfig config;

    public ScoreConverter() {
        this(ScoreframeConfig.defaults());
    }

    public ScoreConverter(ScoreframeConfig config) {
        this.config = config;
    }

    public ConversionResult<ImportedScore> importLilyPond(String source) throws ParseException, ConversionException {
        ConversionContext ctx = newContext();
        LilyPondFile file = LilyPondParser.parse(source);
        return ctx.result(new LilyPondImporter(ctx).importFile(file));
    }

    public ConversionResult<String> exportLilyPond(ImportedScore score) throws ConversionException {
        ConversionContext ctx = newContext();
        return ctx.result(new LilyPondExporter(ctx).export(score));
    }

    /**
     * Parses, imports and exports again. The result is the canonical text of the source; warnings of
     * both directions are collected.
     */
    public ConversionResult<String> roundTrip(String source) throws ParseException, ConversionException {
        ConversionContext ctx = newContext();
        ImportedScore score = new LilyPondImporter(ctx).importFile(LilyPondParser.parse(source));
        return ctx.result(new LilyPondExporter(ctx).export(score));
    }

    public ConversionResult<PartList> exportPartList(ImportedScore score) throws ConversionException {
        ConversionContext ctx = newContext();
        return ctx.result(new PartListExporter().exportParts(score.document.scoreDef, score.store, ctx));
    }

    public ValidationResult validate(MeiDocument document) {
        return new MeiValidator().validate(document);
    }

    public ScoreframeConfig getConfig() {
        return config;
    }

    private ConversionContext newContext() {
        return new ConversionContext(config.getIdPrefix());
    }
}
