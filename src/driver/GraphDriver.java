package driver;

import backend.DotPrinter;
import exception.UsageException;
import frontend.QuilFrontend;
import frontend.QuilParseException;
import graph.ProgramGraph;
import ir.Program;
import pass.PassManager;
import util.logging.LogManager;
import util.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

public class GraphDriver {
    private static final GraphDriver graphDriver = new GraphDriver();
    private static final Logger logger = LogManager.getLogger(GraphDriver.class);

    private String source = null;
    private String target = null;
    private boolean verify = Config.getInstance().isVerify();

    private GraphDriver() {
    }

    public static GraphDriver getInstance() {
        return graphDriver;
    }

    /**
     * @return the input being processed, or null before arguments are parsed
     */
    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public boolean isVerify() {
        return verify;
    }

    /*
     * parse the args based on the input
     */
    public void parseArgs(String[] args) throws UsageException {
        if (args == null || args.length == 0) {
            throw UsageException.noArgs();
        }
        source = null;
        target = null;
        verify = Config.getInstance().isVerify();

        var iter = Arrays.asList(args).iterator();
        while (iter.hasNext()) {
            String cmd = iter.next();
            switch (cmd) {
                case "-o" -> {
                    if (iter.hasNext()) {
                        target = iter.next();
                    } else {
                        throw UsageException.wrongArgs("Need arg after -o but got nothing");
                    }
                }
                case "--no-verify" -> verify = false;
                default -> {
                    if (cmd.endsWith(".quil") && source == null) {
                        source = cmd;
                    } else {
                        throw UsageException.wrongArgs(cmd);
                    }
                }
            }
        }
        if (source == null) {
            throw UsageException.noArgs();
        }
    }

    /*
     * parse -> build -> export; the graph goes to stdout when no -o is given
     */
    public void run() throws IOException, QuilParseException {
        if (source == null) {
            throw UsageException.noArgs();
        }
        // stdout carries the graph unless -o is given
        if (Config.getInstance().isDebug() && target != null) {
            LogManager.enableConsole();
        }
        Program program = QuilFrontend.parse(Path.of(source));
        logger.info("{}: {} instructions", source, program.size());

        ProgramGraph graph = new PassManager(verify).build(program);
        logger.info("{}: {} blocks, exits {}", source, graph.getBlockCount(), graph.getExitBlocks().size());

        DotPrinter printer = DotPrinter.getInstance();
        if (target == null) {
            System.out.print(printer.printToString(graph));
        } else {
            printer.printToFile(graph, target);
        }
    }
}
