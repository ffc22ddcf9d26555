package com.morphirbridge.core.naming;

import java.util.List;

/**
 * The Morphir SDK package is spelled {@code [["morphir"],["s","d","k"]]} by classic tools and
 * {@code morphir/sdk} by V4 tools. Parsers normalize to their own version's spelling and the
 * migration engine converts between the two.
 */
public final class PackageAliases {

    public static final Path CLASSIC_SDK = new Path(List.of(Name.of("morphir"), Name.of("s", "d", "k")));
    public static final Path V4_SDK = new Path(List.of(Name.of("morphir"), Name.of("sdk")));

    private PackageAliases() {
        // Utility class
    }

    public static boolean isSdk(Path packagePath) {
        return CLASSIC_SDK.equals(packagePath) || V4_SDK.equals(packagePath);
    }

    public static Path toClassic(Path packagePath) {
        return V4_SDK.equals(packagePath) ? CLASSIC_SDK : packagePath;
    }

    public static Path toV4(Path packagePath) {
        return CLASSIC_SDK.equals(packagePath) ? V4_SDK : packagePath;
    }

    public static FQName toClassic(FQName fqName) {
        return new FQName(toClassic(fqName.packagePath()), fqName.modulePath(), fqName.localName());
    }

    public static FQName toV4(FQName fqName) {
        return new FQName(toV4(fqName.packagePath()), fqName.modulePath(), fqName.localName());
    }
}
