package se.kth.syntax.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import picocli.CommandLine.IVersionProvider;

/**
 * Provides the CLI with the version of the packaged library.
 *
 * @author Simon Larsén
 */
public class SyntaxVersionProvider implements IVersionProvider {
    static final String POM_PROPERTIES = "META-INF/maven/se.kth/fidelity-syntax/pom.properties";

    @Override
    public String[] getVersion() {
        return new String[] {"fidelity-syntax " + getVersionFromPomProperties()};
    }

    private String getVersionFromPomProperties() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(POM_PROPERTIES)) {
            if (in == null) {
                return "LOCAL";
            }
            Properties props = new Properties();
            props.load(in);
            return props.getProperty("version", "LOCAL");
        } catch (IOException e) {
            return "LOCAL";
        }
    }
}
