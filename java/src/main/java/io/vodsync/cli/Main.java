package io.vodsync.cli;

import io.vodsync.Config;
import io.vodsync.SyncManager;
import io.vodsync.SyncReport;
import io.vodsync.VodSyncException;
import io.vodsync.auth.AuthSession;
import io.vodsync.auth.LwpCookieFile;
import io.vodsync.auth.Session;
import io.vodsync.catalog.Course;
import io.vodsync.catalog.Subject;
import io.vodsync.manifest.Aria2DownloadAgent;
import io.vodsync.manifest.Manifest;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Command-line entry point: log in, synchronise every favourite subject and download all known recordings.
 *
 * <pre>
 * Usage:
 *   Main [--snapshot &lt;file&gt;] [--cookies &lt;file&gt;] [--out &lt;dir&gt;] [--screen] [--offline]
 * </pre>
 *
 * <p>{@code --offline} skips the login and refreshes courses with the tokens stored in the snapshot. Existing files
 * in the output directory are left alone, so repeated runs only fetch new recordings.
 */
public final class Main {

    static final String DEFAULT_SNAPSHOT = "subjects.json";
    static final String DEFAULT_COOKIES = "cookies.txt";
    static final String DEFAULT_OUT = "videos";

    private Main() {
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Options options = Options.parse(args);
        if (options == null) {
            usage(err);
            return 2;
        }

        try {
            Config config = Config.defaults();
            SyncManager manager = SyncManager.open(config, options.snapshot, new Aria2DownloadAgent());
            SyncReport report;
            if (options.offline) {
                report = manager.update();
            } else {
                Session session = new AuthSession(config, new ConsoleOperator(), new LwpCookieFile(options.cookies))
                    .authenticate();
                report = manager.synchronize(session);
            }
            print(report, out);

            Manifest manifest = manager.download(selectAll(manager), options.out, options.screen);
            out.println("Downloads queued: " + manifest.jobs().size());
            out.println("Subtitle files  : " + manifest.subtitles().size());
            return report.isComplete() ? 0 : 1;
        } catch (VodSyncException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static Map<Long, Set<Long>> selectAll(SyncManager manager) {
        Map<Long, Set<Long>> selection = new LinkedHashMap<>();
        for (Subject subject : manager.snapshot().subjects()) {
            Set<Long> courses = new LinkedHashSet<>();
            for (Course course : subject.courses()) {
                courses.add(course.id());
            }
            selection.put(subject.id(), courses);
        }
        return selection;
    }

    private static void print(SyncReport report, PrintStream out) {
        out.println("Subjects synced : " + report.synced().size());
        if (!report.skipped().isEmpty()) {
            out.println("Subjects skipped: " + report.skipped());
        }
        report.failed().forEach((id, ex) -> out.println("Subject " + id + " failed: " + ex.getMessage()));
    }

    private static void usage(PrintStream err) {
        err.println("Usage: Main [--snapshot <file>] [--cookies <file>] [--out <dir>] [--screen] [--offline]");
        err.println();
        err.println("  --snapshot <file>  Synchronisation state (default: " + DEFAULT_SNAPSHOT + ")");
        err.println("  --cookies <file>   Stored login cookie (default: " + DEFAULT_COOKIES + ")");
        err.println("  --out <dir>        Download directory (default: " + DEFAULT_OUT + ")");
        err.println("  --screen           Also download the screen capture channel");
        err.println("  --offline          Skip the login and reuse stored tokens");
    }

    static final class Options {
        Path snapshot = Path.of(DEFAULT_SNAPSHOT);
        Path cookies = Path.of(DEFAULT_COOKIES);
        Path out = Path.of(DEFAULT_OUT);
        boolean screen;
        boolean offline;

        /**
         * @return parsed options, or {@code null} on an unknown flag or a flag missing its value.
         */
        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                boolean hasValue = i + 1 < args.length;
                if ("--snapshot".equals(arg) && hasValue) {
                    options.snapshot = Path.of(args[++i]);
                } else if ("--cookies".equals(arg) && hasValue) {
                    options.cookies = Path.of(args[++i]);
                } else if ("--out".equals(arg) && hasValue) {
                    options.out = Path.of(args[++i]);
                } else if ("--screen".equals(arg)) {
                    options.screen = true;
                } else if ("--offline".equals(arg)) {
                    options.offline = true;
                } else {
                    return null;
                }
            }
            return options;
        }
    }
}
