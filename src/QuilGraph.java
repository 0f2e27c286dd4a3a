import driver.*;
import exception.ProgramGraphException;
import exception.UsageException;
import frontend.QuilParseException;
import util.logging.LogManager;

import java.io.IOException;

public class QuilGraph {
    /*
     * move the duty of the tool to driver,
     * for we can't use package here
     */
    public static void main(String[] args) {
        GraphDriver driver = GraphDriver.getInstance();
        try {
            driver.parseArgs(args);
            driver.run();
        } catch (UsageException e) {
            System.err.println(e.getMessage());
            System.err.println("usage: QuilGraph <input.quil> [-o <output.dot>] [--no-verify]");
            System.exit(2);
        } catch (QuilParseException | ProgramGraphException | IOException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        } finally {
            LogManager.shutdown();
        }
    }
}
