/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher;

import juuxel.synthlauncher.cli.InstallCommand;
import juuxel.synthlauncher.cli.LoginCommand;
import juuxel.synthlauncher.data.Account;
import juuxel.synthlauncher.data.ReleaseKind;
import juuxel.synthlauncher.host.TaskDispatcher;
import juuxel.synthlauncher.task.LauncherException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@CommandLine.Command(
    name = "synth-launcher",
    mixinStandardHelpOptions = true,
    subcommands = {InstallCommand.class, LoginCommand.class}
)
public final class SynthLauncher implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SynthLauncher.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-d", "--data-dir"}, description = "Where versions, assets, libraries and accounts are stored.")
    public Path dataDirectory = Path.of(System.getProperty("user.home"), ".synth-launcher");

    @CommandLine.Option(names = "--concurrency", description = "Parallel downloads per pipeline.")
    public int concurrency = LauncherConfig.DEFAULT_CONCURRENCY;

    @CommandLine.Option(names = "--retries", description = "Attempts per file before a download fails.")
    public int retries = LauncherConfig.DEFAULT_RETRIES;

    @CommandLine.Option(names = "--poll-interval", description = "Milliseconds between progress updates.")
    public long pollInterval = LauncherConfig.DEFAULT_POLL_INTERVAL.toMillis();

    @CommandLine.Option(names = "--client-id", description = "OAuth client id used to sign in.")
    public String clientId = LauncherConfig.DEFAULT_CLIENT_ID;

    @CommandLine.Option(names = "--mirror", description = "Base URL serving every remote endpoint, for local mirrors.")
    public @Nullable String mirror;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    public LauncherConfig config() {
        return new LauncherConfig(
            dataDirectory,
            mirror != null ? Endpoints.under(mirror) : Endpoints.DEFAULT,
            concurrency,
            retries,
            Duration.ofMillis(pollInterval),
            clientId,
            OperatingSystem.current()
        );
    }

    /**
     * Opens a launcher session and a dispatcher for one command and reports its failure, if any.
     *
     * @return the process exit code
     */
    public int execute(Action action) {
        var config = config();

        try (var launcher = Launcher.open(config); var dispatcher = new TaskDispatcher(config.pollInterval())) {
            action.run(launcher, dispatcher);
            return 0;
        } catch (LauncherException e) {
            if (e.isCancelled()) {
                LOGGER.debug("Cancelled", e);
                System.out.println("Cancelled.");
            } else {
                LOGGER.error("{} [{}]", e.getMessage(), e.kind());
                LOGGER.debug("Failure details", e);
            }
            return 1;
        }
    }

    public static <T> T join(CompletableFuture<T> future) throws LauncherException {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw LauncherException.of(e.getCause(), "Command");
        }
    }

    @CommandLine.Command(name = "versions", description = "Lists the versions in the manifest.")
    int versions(@CommandLine.Option(names = "--snapshots", description = "Include snapshots and old versions.") boolean snapshots) {
        return execute((launcher, dispatcher) -> {
            var manifest = join(dispatcher.watch(launcher.resolveManifest()));
            for (var version : manifest.versions()) {
                if (snapshots || version.type() == ReleaseKind.RELEASE) {
                    System.out.println(version.id() + "\t" + version.type().name().toLowerCase(Locale.ROOT));
                }
            }
        });
    }

    @CommandLine.Command(name = "accounts", description = "Lists the signed-in accounts.")
    int accounts() {
        return execute((launcher, dispatcher) -> {
            var accounts = launcher.state().accounts().toList();
            if (accounts.isEmpty()) System.out.println("No accounts. Run 'login' to add one.");

            for (int i = 0; i < accounts.size(); i++) {
                Account account = accounts.get(i);
                System.out.println(i + "\t" + account.displayName() + (account.needsRefresh() ? "\t(needs refresh)" : ""));
            }
        });
    }

    @CommandLine.Command(name = "refresh", description = "Refreshes the tokens of an account.")
    int refresh(@CommandLine.Parameters(paramLabel = "INDEX") int index) {
        return execute((launcher, dispatcher) -> {
            var account = join(dispatcher.watch(launcher.refreshAccount(index)));
            System.out.println("Refreshed " + account.displayName());
        });
    }

    @CommandLine.Command(name = "remove-account", description = "Removes an account. Higher indices shift down.")
    int removeAccount(@CommandLine.Parameters(paramLabel = "INDEX") int index) {
        return execute((launcher, dispatcher) -> System.out.println("Removed " + launcher.removeAccount(index).displayName()));
    }

    @CommandLine.Command(name = "jvms", description = "Lists the registered Java runtimes.")
    int jvms() {
        return execute((launcher, dispatcher) -> {
            var jvms = launcher.state().jvms().toList();
            for (int i = 0; i < jvms.size(); i++) {
                System.out.println(i + "\t" + jvms.get(i).name() + "\t" + jvms.get(i).path());
            }
        });
    }

    @CommandLine.Command(name = "add-jvm", description = "Registers a Java executable.")
    int addJvm(@CommandLine.Parameters(paramLabel = "PATH") String path) {
        return execute((launcher, dispatcher) -> {
            var jvm = join(dispatcher.watch(launcher.addJvm(path)));
            System.out.println("Added " + jvm.name());
        });
    }

    @CommandLine.Command(name = "remove-jvm", description = "Removes a registered Java runtime. The default cannot be removed.")
    int removeJvm(@CommandLine.Parameters(paramLabel = "INDEX") int index) {
        return execute((launcher, dispatcher) -> System.out.println("Removed " + launcher.removeJvm(index).name()));
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SynthLauncher()).execute(args);
        System.exit(exitCode);
    }

    @FunctionalInterface
    public interface Action {
        void run(Launcher launcher, TaskDispatcher dispatcher) throws LauncherException;
    }
}
