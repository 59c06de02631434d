package floc.utility;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

public class Util {
    private final static Logger logger = LogManager.getLogger(Util.class);

    public static void writeToYaml(Object o, String filePath) throws OptException {
        try (BufferedWriter writer = new BufferedWriter(new FileWriter(filePath))) {
            writeToYaml(o, writer, filePath);
        } catch (IOException ex) {
            logger.error(ex);
            throw new OptException("error writing to YAML file " + filePath, ex);
        }
    }

    /**
     * Dumps the object to the writer and flushes it; the writer is left open.
     */
    public static void writeToYaml(Object o, Writer writer, String target) throws OptException {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        Yaml yaml = new Yaml(options);
        try {
            yaml.dump(o, writer);
            writer.flush();
        } catch (IOException ex) {
            logger.error(ex);
            throw new OptException("error writing YAML to " + target, ex);
        }
    }

    public static Object readFromYaml(String filePath) throws OptException {
        try (BufferedReader reader = new BufferedReader(new FileReader(filePath))) {
            return readFromYaml(reader, filePath);
        } catch (IOException ex) {
            logger.error(ex);
            throw new OptException("error reading YAML file " + filePath, ex);
        }
    }

    /**
     * Parses one YAML (or JSON) document from the reader; the reader is left open.
     */
    public static Object readFromYaml(Reader reader, String source) throws OptException {
        try {
            return new Yaml().load(reader);
        } catch (RuntimeException ex) {
            // SnakeYAML reports syntax and read problems as unchecked YAMLException.
            logger.error(ex);
            throw new OptException("malformed YAML in " + source, ex);
        }
    }
}
