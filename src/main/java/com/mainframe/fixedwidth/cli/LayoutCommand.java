package com.mainframe.fixedwidth.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.fixedwidth.cli.exception.OptionsValidationException;
import com.mainframe.fixedwidth.cli.model.CommandOptions;
import com.mainframe.fixedwidth.cli.model.ValidatedCommandOptions;
import com.mainframe.fixedwidth.cli.output.ResultsPrinter;
import com.mainframe.fixedwidth.cli.validation.CommandOptionsValidator;
import com.mainframe.fixedwidth.cli.validation.CommandOptionsValidator.Requirement;
import com.mainframe.fixedwidth.exception.FixedWidthException;
import com.mainframe.fixedwidth.exception.LayoutParseException;
import com.mainframe.fixedwidth.exception.SchemaException;
import com.mainframe.fixedwidth.layout.LayoutParser;
import com.mainframe.fixedwidth.schema.Definition;
import com.mainframe.fixedwidth.schema.Schema;

import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Shared flow of the sub-commands: validate options, load the layout, run, map failures to
 * exit code 1.
 */
public abstract class LayoutCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LayoutCommand.class);

    @Mixin
    protected CommandOptions options;

    @Spec
    protected CommandSpec spec;

    private final CommandOptionsValidator validator = new CommandOptionsValidator();

    @Override
    public Integer call() {
        String command = spec.name();
        try {
            ValidatedCommandOptions validated = validator.validate(command, options, requirements());
            Definition definition = new LayoutParser().parse(validated.getLayout())
                    .toDefinition(validated.getLayout().getFileName().toString());
            ResultsPrinter printer = new ResultsPrinter(spec.commandLine().getOut());
            return execute(definition, validated, printer);

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (LayoutParseException e) {
            log.error("Invalid layout: {}", e.getMessage());
            return 1;
        } catch (IOException | FixedWidthException e) {
            log.error("'{}' failed: {}", command, e.getMessage(), e);
            return 1;
        }
    }

    protected Requirement[] requirements() {
        return new Requirement[0];
    }

    protected abstract int execute(Definition definition, ValidatedCommandOptions options, ResultsPrinter printer)
            throws IOException;

    protected static Schema requireSchema(Definition definition, String name) {
        return definition.lookupByName(name).stream().findFirst()
                .orElseThrow(() -> new SchemaException("No schema named '" + name + "' in " + definition.getName()));
    }
}
