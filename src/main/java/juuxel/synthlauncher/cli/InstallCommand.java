/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.cli;

import juuxel.synthlauncher.SynthLauncher;
import juuxel.synthlauncher.download.DownloadSet;
import juuxel.synthlauncher.download.LaunchPlan;
import picocli.CommandLine;

import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@CommandLine.Command(name = "install", description = "Resolves a version and downloads its assets, libraries and client jar.")
public final class InstallCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    SynthLauncher parent;

    @CommandLine.Parameters(index = "0", arity = "1", paramLabel = "VERSION", description = "A version id, 'latest' or 'latest-snapshot'.")
    public String version;

    @Override
    public Integer call() {
        return parent.execute((launcher, dispatcher) -> {
            SynthLauncher.join(dispatcher.watch(launcher.resolveManifest()));
            int index = launcher.state().versionIndex(version);
            var resolved = SynthLauncher.join(dispatcher.watch(launcher.selectVersion(index)));
            System.out.println(":resolved " + resolved.id());

            DownloadSet downloads = launcher.startDownloads();
            var printer = new ProgressLine(() -> describe(downloads));
            dispatcher.onTick(printer);
            LaunchPlan plan;
            try {
                plan = SynthLauncher.join(dispatcher.watch(downloads));
            } finally {
                printer.finish();
            }

            System.out.println(":ready to launch " + plan.versionId() + " with " + plan.mainClass());
            System.out.println("  assets:  " + plan.assetsRoot() + " (index " + plan.assetIndexId() + ")");
            System.out.println("  natives: " + plan.nativesDirectory());
            System.out.println("  jar:     " + plan.clientJar());
        });
    }

    private static String describe(DownloadSet downloads) {
        return downloads.runs()
            .stream()
            .map(run -> run.name() + " " + run.progress().snapshot())
            .collect(Collectors.joining("  "));
    }
}
