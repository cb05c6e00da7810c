package com.example.waivermerger.application.exception;

import java.util.List;

/**
 * Signals that a merge ran but not a single matched document could be decoded.
 * The assembler itself reports this as an absent result; callers raise this to present a
 * "nothing to merge" outcome distinct from a partial success.
 */
public class NoOutputProducedException extends ApplicationException {

    private final List<String> itemErrors;

	/**
	 * Creates the exception with the per-item errors explaining why nothing was merged.
	 *
	 * @param itemErrors errors collected during assembly, possibly empty
	 */
    public NoOutputProducedException(List<String> itemErrors) {
        super(itemErrors.isEmpty()
                ? "There were no matched documents to merge."
                : "Could not merge PDFs. All " + itemErrors.size() + " matched files are invalid.");
        this.itemErrors = List.copyOf(itemErrors);
    }

    public List<String> getItemErrors() {
        return itemErrors;
    }
}
