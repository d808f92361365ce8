package dev.mars.netdrive.core;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


/**
 * Helpers for '/'-separated remote paths, independent of the local filesystem's separator.
 */
public final class RemotePaths {

    private RemotePaths() {
    }

    public static String join(String parent, String child) {
        if (parent == null || parent.isEmpty() || "/".equals(parent)) {
            return "/" + stripLeading(child);
        }
        String base = parent.endsWith("/") ? parent.substring(0, parent.length() - 1) : parent;
        return base + "/" + stripLeading(child);
    }

    public static String normalize(String path) {
        if (path == null || path.isBlank()) {
            return "/";
        }
        String p = path.replace('\\', '/').replaceAll("/{2,}", "/");
        if (!p.startsWith("/")) {
            p = "/" + p;
        }
        if (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    /**
     * @return the parent path, or "/" for top-level entries
     */
    public static String parent(String path) {
        String p = normalize(path);
        int idx = p.lastIndexOf('/');
        return idx <= 0 ? "/" : p.substring(0, idx);
    }

    public static String fileName(String path) {
        String p = normalize(path);
        return p.substring(p.lastIndexOf('/') + 1);
    }

    /**
     * Whether {@code path} is {@code root} itself or lies below it.
     */
    public static boolean isBelow(String root, String path) {
        String r = normalize(root);
        String p = normalize(path);
        return "/".equals(r) || p.equals(r) || p.startsWith(r + "/");
    }

    /**
     * Resolve a path against a drive root. Paths already below the root are kept as they are.
     */
    public static String resolve(String root, String path) {
        String p = normalize(path);
        return isBelow(root, p) ? p : join(normalize(root), p);
    }

    /**
     * @return {@code path} relative to {@code root}, without a leading '/'
     */
    public static String relativize(String root, String path) {
        String r = normalize(root);
        String p = normalize(path);
        if (!isBelow(r, p)) {
            throw new IllegalArgumentException(p + " is not below " + r);
        }
        String rel = "/".equals(r) ? p : p.substring(r.length());
        return stripLeading(rel);
    }

    private static String stripLeading(String s) {
        int i = 0;
        while (i < s.length() && s.charAt(i) == '/') {
            i++;
        }
        return s.substring(i);
    }
}
