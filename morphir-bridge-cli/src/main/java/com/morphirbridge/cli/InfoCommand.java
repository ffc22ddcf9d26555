package com.morphirbridge.cli;

import com.morphirbridge.core.format.CosmeticLoss;
import com.morphirbridge.core.format.ParsedDistribution;
import com.morphirbridge.core.model.Distribution;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Command to detect the format of IR and summarize its contents.
 */
@Command(
    name = "info",
    description = "Detect the format version of IR and summarize its modules",
    mixinStandardHelpOptions = true
)
public class InfoCommand extends IrCommand {

    @Parameters(index = "0", description = "IR file or document tree directory")
    private Path input;

    @Override
    protected void execute() {
        ParsedDistribution parsed = load(input);
        Distribution distribution = parsed.distribution();
        PrintWriter out = out();
        out.println("Format:       " + parsed.version());
        out.println("Package:      " + distribution.packageName().toCanonicalString());
        out.println("Modules:      " + distribution.modules().size());
        out.println("Types:        " + distribution.typeCount());
        out.println("Values:       " + distribution.valueCount());
        out.println("Dependencies: " + distribution.dependencies().size());
        distribution.modules().forEach((path, module) ->
            out.println("  " + path.toCanonicalString() + " (" + module.access().name().toLowerCase(Locale.ROOT) + ")"));
        for (CosmeticLoss loss : parsed.cosmeticLosses()) {
            out.println("Dropped on read: " + loss.description());
        }
        out.flush();
    }
}
