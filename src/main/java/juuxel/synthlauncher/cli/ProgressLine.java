/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.cli;

import java.util.function.Supplier;

/**
 * Redraws a single console line whenever its text changes. Runs as a dispatcher tick listener.
 */
final class ProgressLine implements Runnable {
    private final Supplier<String> text;
    private String last = "";

    ProgressLine(Supplier<String> text) {
        this.text = text;
    }

    @Override
    public synchronized void run() {
        var current = text.get();
        if (current.equals(last)) return;

        // pad so a shorter line fully overwrites the previous one
        var padding = " ".repeat(Math.max(0, last.length() - current.length()));
        System.out.print("\r" + current + padding);
        System.out.flush();
        last = current;
    }

    synchronized void finish() {
        run();
        System.out.println();
    }
}
