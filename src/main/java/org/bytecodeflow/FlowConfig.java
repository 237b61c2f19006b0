package org.bytecodeflow;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Settings from {@code bytecode-flow.properties} on the classpath, each
 * overridable by a {@code -Dbytecodeflow.<key>} system property.
 */
public class FlowConfig {

    public static final String RESOURCE = "/bytecode-flow.properties";
    public static final String SYSTEM_PREFIX = "bytecodeflow.";

    private final Properties props;

    public FlowConfig(Properties props) {
        this.props = props;
    }

    public static FlowConfig load() {
        Properties p = new Properties();
        try (InputStream in = FlowConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) p.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("cannot read " + RESOURCE + ": " + e.getMessage(), e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(SYSTEM_PREFIX)) {
                p.setProperty(key.substring(SYSTEM_PREFIX.length()), System.getProperty(key));
            }
        }
        return new FlowConfig(p);
    }

    public Path getOutputDir() {
        return Paths.get(props.getProperty("output.dir", "out"));
    }

    public int getOperandWidth() {
        return intProperty("display.operand-width", 20);
    }

    public int getInstructionWidth() {
        return intProperty("display.instruction-width", 30);
    }

    private int intProperty(String key, int def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("property " + key + " is not an integer: " + v, e);
        }
    }
}
