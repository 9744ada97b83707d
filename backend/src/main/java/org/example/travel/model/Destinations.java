package org.example.travel.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Name matching over a list of destinations. A query matches when either string
 * contains the other, ignoring case; the first match in list order wins.
 */
public final class Destinations {

    private static final int HINT_SIZE = 5;

    private Destinations() {
    }

    public static Optional<Destination> findByName(List<Destination> destinations, String query) {
        var q = query.toLowerCase(Locale.ROOT);
        return destinations.stream()
                .filter(d -> {
                    var name = d.countryName().toLowerCase(Locale.ROOT);
                    return name.contains(q) || q.contains(name);
                })
                .findFirst();
    }

    /** First few country names, comma separated, for "did you mean" hints. */
    public static String sampleNames(List<Destination> destinations) {
        return destinations.stream()
                .limit(HINT_SIZE)
                .map(Destination::countryName)
                .collect(Collectors.joining(", "));
    }
}
