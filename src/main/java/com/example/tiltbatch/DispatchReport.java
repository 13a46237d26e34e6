package com.example.tiltbatch;

/**
 * Summary of one dispatch round.
 *
 * @param state       pending items and done table after the last harvest
 * @param chunks      number of chunks launched
 * @param launched    number of tool invocations started
 * @param completed   items moved to the done table
 * @param unconfirmed items whose tool succeeded without producing the expected output
 */
public record DispatchReport(
        WorkState state,
        int chunks,
        int launched,
        int completed,
        int unconfirmed
) {
}
