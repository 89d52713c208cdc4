package imagematch.processors;

import imagematch.exceptions.*;
import imagematch.models.*;
import imagematch.utils.*;
import org.apache.commons.logging.*;

import java.nio.file.*;
import java.util.*;

/**
 * Linear first-match search of one fingerprint against a corpus.
 * <p>
 * Candidates are scanned in the order supplied and the scan stops at the first one within the
 * threshold. This is the first acceptable match in enumeration order, not the closest match in
 * the corpus. The query file itself, compared by absolute normalized path, is never a match.
 */
public class FirstMatchSearcher {
    private static final Log log = LogFactory.getLog(FirstMatchSearcher.class);

    public Optional<Match> findFirstMatch(Fingerprint query,
                                          Path queryPath,
                                          Iterable<Candidate> candidates,
                                          double thresholdPercent) {
        int maxDistance = Similarity.maxDistance(thresholdPercent, query.bitLength());
        Path queryAbsolute = queryPath.toAbsolutePath().normalize();

        int scanned = 0;
        for (Candidate candidate : candidates) {
            scanned++;
            if (candidate.path().toAbsolutePath().normalize().equals(queryAbsolute)) continue;
            if (!candidate.hasFingerprint()) continue;

            int distance;
            try {
                distance = query.distanceTo(candidate.fingerprint());
            } catch (IncompatibleFingerprintException e) {
                log.warn("Could not compare hashes for " + candidate.path() + ": " + e.getMessage());
                continue;
            }

            if (distance <= maxDistance) {
                // floor in maxDistance can admit a distance that is just under the threshold
                double similarity = Similarity.percent(distance, query.bitLength());
                if (similarity >= thresholdPercent) {
                    return Optional.of(new Match(queryPath, candidate.path(), distance, similarity, scanned));
                }
            }
        }
        return Optional.empty();
    }
}
