/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.state;

import juuxel.synthlauncher.data.Jvm;
import juuxel.synthlauncher.task.LauncherException;

import java.util.ArrayList;
import java.util.List;

/**
 * The registered Java runtimes. Index 0 is always {@link Jvm#SYSTEM_DEFAULT}; it cannot be
 * removed and is not persisted.
 */
public final class JvmRegistry {
    private final List<Jvm> jvms = new ArrayList<>();

    JvmRegistry(List<Jvm> persisted) {
        jvms.add(Jvm.SYSTEM_DEFAULT);
        jvms.addAll(persisted);
    }

    public synchronized int size() {
        return jvms.size();
    }

    public synchronized Jvm get(int index) throws LauncherException {
        checkIndex(index);
        return jvms.get(index);
    }

    public synchronized int add(Jvm jvm) {
        jvms.add(jvm);
        return jvms.size() - 1;
    }

    public synchronized Jvm remove(int index) throws LauncherException {
        if (index == 0) throw LauncherException.precondition("The system default JVM cannot be removed");
        checkIndex(index);
        return jvms.remove(index);
    }

    public synchronized List<Jvm> toList() {
        return List.copyOf(jvms);
    }

    /** Every entry except the system default. */
    public synchronized List<Jvm> persisted() {
        return List.copyOf(jvms.subList(1, jvms.size()));
    }

    private void checkIndex(int index) throws LauncherException {
        if (index < 0 || index >= jvms.size()) {
            throw LauncherException.precondition("No JVM at index " + index + " (" + jvms.size() + " registered)");
        }
    }
}
