/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.cli;

import juuxel.synthlauncher.SynthLauncher;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "login", description = "Signs in a Microsoft account with a device code.")
public final class LoginCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    SynthLauncher parent;

    @Override
    public Integer call() {
        return parent.execute((launcher, dispatcher) -> {
            var session = SynthLauncher.join(dispatcher.watch(launcher.requestDeviceCode()));
            System.out.println("Open " + session.verificationUrl() + " and enter the code " + session.userCode());

            var account = SynthLauncher.join(dispatcher.watch(launcher.pollDeviceAuthorization()));
            System.out.println("Signed in as " + account.displayName());
        });
    }
}
