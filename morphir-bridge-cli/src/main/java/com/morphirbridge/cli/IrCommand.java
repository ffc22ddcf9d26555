package com.morphirbridge.cli;

import com.morphirbridge.core.MorphirBridge;
import com.morphirbridge.core.error.IrException;
import com.morphirbridge.core.format.ParsedDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Base class for commands that work on IR: maps {@link IrException} to exit code 1 and
 * writes results to the command line's output stream.
 */
public abstract class IrCommand implements Callable<Integer> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final MorphirBridge bridge = new MorphirBridge();

    @Spec
    protected CommandSpec spec;

    @Override
    public final Integer call() {
        try {
            execute();
            return 0;
        } catch (IrException e) {
            log.error("{} failed [{}]: {}", spec.name(), e.kind(), e.getMessage());
            return 1;
        }
    }

    protected abstract void execute();

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected ParsedDistribution load(Path input) {
        VfsLocation location = VfsLocation.forInput(input);
        return bridge.load(location.vfs(), location.path());
    }
}
