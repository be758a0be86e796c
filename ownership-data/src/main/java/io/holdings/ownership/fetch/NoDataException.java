package io.holdings.ownership.fetch;

import io.holdings.ownership.model.StoreKey;

/** The source confirmed there is no disclosure for this security and date. Not an error. */
public class NoDataException extends FetchException {
    public NoDataException(StoreKey key, String message) {
        super(key, message, null);
    }
}
