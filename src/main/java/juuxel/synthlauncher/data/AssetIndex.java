/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.data;

import com.squareup.moshi.JsonDataException;

import java.util.Map;

public record AssetIndex(Map<String, AssetObject> objects) {
    public AssetIndex validate() {
        Required.member(objects, "objects", "the asset index").forEach((name, object) -> {
            var hash = Required.member(Required.member(object, name, "the asset index").hash(), "hash", name);
            if (hash.length() < 2) throw new JsonDataException("Malformed hash of " + name + ": " + hash);
        });
        return this;
    }

    public record AssetObject(String hash, long size) {
        public String relativePath() {
            return hash.substring(0, 2) + "/" + hash;
        }
    }
}
