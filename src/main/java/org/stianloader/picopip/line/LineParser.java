package org.stianloader.picopip.line;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.RequirementParseException.Kind;
import org.stianloader.picopip.VcsType;
import org.stianloader.picopip.marker.Marker;
import org.stianloader.picopip.version.SpecifierSet;

/**
 * Splits pip requirement lines into their components.
 *
 * <pre>
 * line := ["-e "] (name [extras] [specifier] | url | vcs+url | path) [extras] [";" marker] {" --hash=" value}
 * </pre>
 */
public final class LineParser {

    private static final String HASH_OPTION = "--hash=";
    private static final Pattern NAMED = Pattern.compile("^([A-Za-z0-9](?:[A-Za-z0-9._-]*[A-Za-z0-9])?)\\s*(\\[[^\\]]*\\])?\\s*(.*)$");
    private static final String[] SCHEME_PREFIXES = {"http://", "https://", "ftp://", "ftps://", "file://"};

    private LineParser() {
        throw new UnsupportedOperationException();
    }

    private static boolean isLocalPath(@NotNull String candidate) {
        if (candidate.startsWith(".") || candidate.startsWith("/") || candidate.startsWith("~") || candidate.startsWith("\\")) {
            return true;
        }
        if (candidate.length() > 2 && Character.isLetter(candidate.charAt(0)) && candidate.charAt(1) == ':'
                && (candidate.charAt(2) == '\\' || candidate.charAt(2) == '/')) {
            return true;
        }
        if (candidate.indexOf('/') != -1 || candidate.indexOf('\\') != -1) {
            return true;
        }
        String lower = candidate.toLowerCase(Locale.ROOT);
        return lower.endsWith(".whl") || lower.endsWith(".zip") || lower.endsWith(".tar.gz") || lower.endsWith(".tgz") || lower.endsWith(".tar.bz2");
    }

    private static boolean isUrl(@NotNull String candidate) {
        int schemeEnd = candidate.indexOf("://");
        if (schemeEnd > 0 && candidate.substring(0, schemeEnd).matches("[A-Za-z][A-Za-z0-9+.-]*")) {
            return true;
        }
        return candidate.regionMatches(true, 0, "file:", 0, 5) || candidate.startsWith("git+git@");
    }

    /**
     * Splits a requirement line into its components.
     *
     * @param line The requirement line
     * @return The parsed line
     * @throws RequirementParseException with {@link Kind#UNPARSABLE_REQUIREMENT} if no installable form can be recognised,
     * or with a more specific kind if the specifier, the marker or the URI are malformed
     */
    @NotNull
    @Contract(pure = true)
    public static RequirementLine parse(@NotNull String line) {
        String remaining = line.trim();
        if (remaining.length() >= 2 && (remaining.charAt(0) == '"' || remaining.charAt(0) == '\'')
                && remaining.charAt(remaining.length() - 1) == remaining.charAt(0)) {
            remaining = remaining.substring(1, remaining.length() - 1).trim();
        }
        if (remaining.isEmpty()) {
            throw new RequirementParseException(Kind.UNPARSABLE_REQUIREMENT, line, "Empty requirement");
        }

        boolean editable = false;
        if (remaining.startsWith("-e ") || remaining.startsWith("-e\t")) {
            editable = true;
            remaining = remaining.substring(3).trim();
        } else if (remaining.startsWith("--editable=")) {
            editable = true;
            remaining = remaining.substring(11).trim();
        } else if (remaining.startsWith("--editable ")) {
            editable = true;
            remaining = remaining.substring(11).trim();
        }

        List<String> hashes = new ArrayList<>();
        int hashStart = LineParser.indexOfHashOption(remaining);
        if (hashStart != -1) {
            String hashPart = remaining.substring(hashStart);
            remaining = remaining.substring(0, hashStart).trim();
            for (String token : hashPart.split("\\s+")) {
                if (token.isEmpty()) {
                    continue;
                }
                if (!token.startsWith(LineParser.HASH_OPTION) || token.length() == LineParser.HASH_OPTION.length()) {
                    throw new RequirementParseException(Kind.UNPARSABLE_REQUIREMENT, line, "Unexpected token '" + token + "' among hash options");
                }
                hashes.add(token.substring(LineParser.HASH_OPTION.length()));
            }
        }

        String markerSeparator = ";";
        for (String prefix : LineParser.SCHEME_PREFIXES) {
            if (remaining.startsWith(prefix)) {
                markerSeparator = "; ";
                break;
            }
        }
        Marker markers = null;
        int markerStart = remaining.indexOf(markerSeparator);
        if (markerStart != -1) {
            String markerString = remaining.substring(markerStart + markerSeparator.length()).trim();
            remaining = remaining.substring(0, markerStart).trim();
            if (!markerString.isEmpty()) {
                markers = Marker.parse(markerString);
            }
        }

        if (remaining.isEmpty()) {
            throw new RequirementParseException(Kind.UNPARSABLE_REQUIREMENT, line, "No installable given");
        }

        hashes = Collections.unmodifiableList(hashes);
        if (ParsedUri.isDirectUrl(remaining) || LineParser.isVcsPrefixed(remaining) || LineParser.isUrl(remaining)) {
            Extras.Split split = LineParser.splitUrlExtras(remaining);
            ParsedUri uri = ParsedUri.parse(split.base());
            List<String> extras = new ArrayList<>(uri.getExtras());
            extras.addAll(split.extras());
            extras = Extras.canonicalize(extras);
            return new RequirementLine(line, editable, null, null, uri.withExtras(extras), null, extras, markers, hashes);
        }

        if (LineParser.isLocalPath(remaining)) {
            Extras.Split split = Extras.split(remaining);
            return new RequirementLine(line, editable, null, null, null, split.base(), split.extras(), markers, hashes);
        }

        Matcher matcher = LineParser.NAMED.matcher(remaining);
        if (!matcher.matches()) {
            throw new RequirementParseException(Kind.UNPARSABLE_REQUIREMENT, line, "Neither a URL, a VCS reference, a path nor a package name");
        }
        String name = matcher.group(1);
        List<String> extras = matcher.group(2) == null ? Collections.emptyList() : Extras.parse(matcher.group(2));
        String specifierString = matcher.group(3).trim();
        if (specifierString.startsWith("(") && specifierString.endsWith(")")) {
            specifierString = specifierString.substring(1, specifierString.length() - 1).trim();
        }
        if (!specifierString.isEmpty() && "=!<>~".indexOf(specifierString.charAt(0)) == -1 && !specifierString.equals("*")) {
            throw new RequirementParseException(Kind.UNPARSABLE_REQUIREMENT, line, "Unexpected trailing text '" + specifierString + "'");
        }
        SpecifierSet specifiers = SpecifierSet.parse(specifierString);
        return new RequirementLine(line, editable, name, specifiers, null, null, extras, markers, hashes);
    }

    private static int indexOfHashOption(@NotNull String string) {
        int index = string.indexOf(" " + LineParser.HASH_OPTION);
        if (index != -1) {
            return index + 1;
        }
        if (string.startsWith(LineParser.HASH_OPTION)) {
            return 0;
        }
        return -1;
    }

    private static boolean isVcsPrefixed(@NotNull String candidate) {
        for (VcsType type : VcsType.values()) {
            if (candidate.startsWith(type.getKey() + "+")) {
                return true;
            }
        }
        return false;
    }

    @NotNull
    private static Extras.Split splitUrlExtras(@NotNull String url) {
        // Only a suffix after the path can be an extras list, a fragment carries its extras in the egg name.
        if (url.indexOf('#') != -1) {
            return new Extras.Split(url, Collections.emptyList());
        }
        return Extras.split(url);
    }

    /**
     * Obtains the marker of a line without parsing the rest of the line. Returns null if the line carries no marker.
     *
     * @param line The requirement line
     * @return The marker string, or null
     */
    @Nullable
    public static String splitMarkers(@NotNull String line) {
        String trimmed = line.trim();
        String separator = ";";
        for (String prefix : LineParser.SCHEME_PREFIXES) {
            if (trimmed.startsWith(prefix)) {
                separator = "; ";
                break;
            }
        }
        int index = trimmed.indexOf(separator);
        if (index == -1) {
            return null;
        }
        String markers = trimmed.substring(index + separator.length()).trim();
        return markers.isEmpty() ? null : markers;
    }
}
