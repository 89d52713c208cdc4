package imagematch.utils;

import picocli.CommandLine.*;

import java.io.*;
import java.util.*;
import java.util.jar.*;

public class ManifestVersionProvider implements IVersionProvider {
    @Override
    public String[] getVersion() throws Exception {
        try (InputStream is = getClass().getResourceAsStream("/META-INF/MANIFEST.MF")) {
            if (is == null) {
                return new String[] { "Version information not available" };
            }
            Attributes attrs = new Manifest(is).getMainAttributes();
            String title = Objects.requireNonNullElse(attrs.getValue("Implementation-Title"), "imagematch");
            String version = Objects.requireNonNullElse(attrs.getValue("Implementation-Version"), "unknown-version");
            String timestamp = Objects.requireNonNullElse(attrs.getValue("Build-Timestamp"), "unknown-timestamp");

            return new String[] {
                    String.format("%s version %s", title, version),
                    String.format("Built on: %s", timestamp),
            };
        }
    }

}
