package com.tazifor.rotator.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Short command line options on top of Spring's --property=value syntax
 *
 *   -p 9090 / --port 9090 / --port=9090  ->  --server.port=9090
 *
 * Everything else is passed through untouched.
 */
public final class LaunchArguments {

    private static final String SERVER_PORT = "--server.port=";

    private LaunchArguments() {
    }

    public static String[] toSpringArguments(String[] args) {
        List<String> translated = new ArrayList<>(args.length);

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("-p") || arg.equals("--port")) {
                if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
                    throw new IllegalArgumentException("Option " + arg + " needs a port number");
                }
                translated.add(SERVER_PORT + args[++i]);
            } else if (arg.startsWith("--port=")) {
                translated.add(SERVER_PORT + arg.substring("--port=".length()));
            } else {
                translated.add(arg);
            }
        }

        return translated.toArray(new String[0]);
    }
}
