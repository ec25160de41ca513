package com.luanvv.parker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.luanvv.parker.core.Config;
import com.luanvv.parker.core.EnvCredentialStore;
import com.luanvv.parker.core.ParkerClient;
import com.luanvv.parker.core.RecordWriters;
import com.luanvv.parker.model.AuthResult;
import com.luanvv.parker.model.CreateResult;
import com.luanvv.parker.model.LookupResult;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Command line front end.
 *
 * <pre>
 *   status
 *   login
 *   lookup &lt;linkedin-url&gt; [first-name] [last-name]
 *   create &lt;first-name&gt; &lt;last-name&gt; &lt;linkedin-url&gt; [yyyy-MM-dd]
 * </pre>
 * Credentials come from the environment variables named in the config's {@code login} section.
 */
@Slf4j
public class App {
    private static final ObjectMapper JSON = RecordWriters.jsonMapper();

    public static void main(String[] args) {
        try {
            System.exit(run(args));
        } catch (Exception e) {
            log.error("Command failed", e);
            System.exit(1);
        }
    }

    static int run(String[] args) throws Exception {
        if (args.length == 0) {
            usage();
            return 2;
        }
        Config config = Config.loadDefault();
        RecordWriters writers = new RecordWriters(config.getOutput());
        try (ParkerClient client = ParkerClient.open(config, new EnvCredentialStore(config.getLogin()))) {
            String[] rest = Arrays.copyOfRange(args, 1, args.length);
            switch (args[0]) {
                case "status" -> {
                    boolean authenticated = client.checkAuthenticated();
                    print(Map.of("authenticated", authenticated));
                    return authenticated ? 0 : 1;
                }
                case "login" -> {
                    AuthResult result = client.login();
                    print(result);
                    return result.ok() ? 0 : 1;
                }
                case "lookup" -> {
                    if (rest.length < 1) {
                        usage();
                        return 2;
                    }
                    LookupResult result = client.lookup(rest[0], arg(rest, 1), arg(rest, 2));
                    if (result instanceof LookupResult.Found found) {
                        writers.write(found.candidate());
                    }
                    print(result);
                    return result instanceof LookupResult.Found || result instanceof LookupResult.NotFound ? 0 : 1;
                }
                case "create" -> {
                    if (rest.length < 3) {
                        usage();
                        return 2;
                    }
                    String date = arg(rest, 3);
                    CreateResult result = client.create(rest[0], rest[1], rest[2], date == null ? null : LocalDate.parse(date));
                    if (result instanceof CreateResult.Created created) {
                        writers.write(created.candidate());
                    } else if (result instanceof CreateResult.AlreadyExists existing) {
                        writers.write(existing.candidate());
                    }
                    print(result);
                    return result.isSuccess() ? 0 : 1;
                }
                default -> {
                    log.error("Unknown command '{}'", args[0]);
                    usage();
                    return 2;
                }
            }
        }
    }

    private static String arg(String[] args, int index) {
        return index < args.length ? args[index] : null;
    }

    private static void print(Object result) throws Exception {
        System.out.println(JSON.writeValueAsString(result));
    }

    private static void usage() {
        System.err.println("""
            usage:
              status
              login
              lookup <linkedin-url> [first-name] [last-name]
              create <first-name> <last-name> <linkedin-url> [yyyy-MM-dd]""");
    }
}
