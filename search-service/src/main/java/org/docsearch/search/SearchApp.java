package org.docsearch.search;

import org.docsearch.search.bootstrap.SearchBootstrap;

public class SearchApp {

    public static void main(String[] args) {
        if (args.length > 0 && ("-h".equals(args[0]) || "--help".equals(args[0]))) {
            printUsage();
            return;
        }
        SearchBootstrap.run(args);
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar search-service.jar [--key value ...]");
        System.out.println();
        System.out.println("Any key from application.properties may be overridden, for example:");
        System.out.println("  --server.port 8000");
        System.out.println("  --storage.data.dir data");
        System.out.println("  --storage.backup.keep 5");
        System.out.println("  --search.default.limit 10");
        System.out.println("  --search.max.limit 100");
        System.out.println();
        System.out.println("Environment variables with the same names, and DATA_DIR, are honoured as well.");
    }
}
