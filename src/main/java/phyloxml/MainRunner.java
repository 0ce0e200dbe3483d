package phyloxml;

import arbor.exceptions.DataFormatException;
import arbor.tree.AttributedTree;
import arbor.tree.NewickReader;
import arbor.tree.TreeJsonReader;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import phyloxml.exceptions.OutputWriteException;

public class MainRunner {

    static Logger _LOG = Logger.getLogger(MainRunner.class);

    public int newick2phyloxml(String [] args) throws DataFormatException, OutputWriteException {
        if (args.length > 3 || args.length < 2) {
            System.out.println("arguments should be: filename.tre [outname.xml]");
            return 1;
        }
        String filename = args[1];
        File outFile = outputFile(args);

        String treeString;
        try {
            treeString = FileUtils.readFileToString(new File(filename), StandardCharsets.UTF_8);
        } catch (IOException ioe) {
            _LOG.error("could not read \"" + filename + "\": " + ioe.getMessage());
            return 1;
        }
        _LOG.info("Reading newick file " + filename);
        AttributedTree tree = new NewickReader().readTree(treeString);

        new PhyloXMLTreeWriter().write(tree, outFile);
        System.out.println("Sucessfully wrote " + tree.getNumberOfVertices() + " clades to file '" + outFile + "'");
        return 0;
    }

    public int json2phyloxml(String [] args) throws DataFormatException, OutputWriteException {
        if (args.length > 3 || args.length < 2) {
            System.out.println("arguments should be: filename.json [outname.xml]");
            return 1;
        }
        String filename = args[1];
        File outFile = outputFile(args);

        AttributedTree tree;
        try {
            _LOG.info("Reading JSON tree file " + filename);
            tree = TreeJsonReader.read(filename);
        } catch (IOException ioe) {
            _LOG.error("could not read \"" + filename + "\": " + ioe.getMessage());
            return 1;
        }

        new PhyloXMLTreeWriter().write(tree, outFile);
        System.out.println("Sucessfully wrote " + tree.getNumberOfVertices() + " clades to file '" + outFile + "'");
        return 0;
    }

    private static File outputFile(String [] args) {
        if (args.length == 3) {
            return new File(args[2]);
        }
        return new File(args[1] + "." + new PhyloXMLTreeWriter().getDefaultFileExtension());
    }

    public static void printHelp() {
        System.out.println("==========================");
        System.out.println("usage: phyloxml-writer is run as:");
        System.out.println("");
        System.out.println("newick2phyloxml newick_tree [out.xml]");
        System.out.println("json2phyloxml json_tree [out.xml]\n");
        System.out.println("Without out.xml the document is written next to the input, with .xml appended.");
    }

    /**
     * @return the process exit code for `args`
     */
    public static int run(String [] args) {
        if (args.length < 1) {
            printHelp();
            return 1;
        }
        String command = args[0];
        if (command.compareTo("help") == 0 || args[0].equals("-h") || args[0].equals("--help")) {
            printHelp();
            return 0;
        }
        int cmdReturnCode = 0;
        try {
            MainRunner mr = new MainRunner();

            if (command.compareTo("newick2phyloxml") == 0) {
                cmdReturnCode = mr.newick2phyloxml(args);
            } else if (command.compareTo("json2phyloxml") == 0) {
                cmdReturnCode = mr.json2phyloxml(args);
            } else {
                System.err.println("Unrecognized command \"" + command + "\"");
                cmdReturnCode = 2;
            }
        } catch (DataFormatException dfx) {
            String action = "Command \"" + command + "\"";
            dfx.reportFailedAction(System.err, action);
            cmdReturnCode = 1;
        } catch (OutputWriteException owx) {
            String action = "Command \"" + command + "\"";
            owx.reportFailedAction(System.err, action);
            cmdReturnCode = 1;
        }
        if (cmdReturnCode == 2) {
            printHelp();
        }
        return cmdReturnCode;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }
}
