package com.source.deblend.api;

import com.source.deblend.catalog.SourceRecord;
import com.source.deblend.deblender.DeblendResult;

import java.util.List;

/**
 * Called for each successfully deblended parent after its children were appended.
 * Not called for failed parents. An exception thrown here is logged; the children stay.
 */
@FunctionalInterface
public interface PostDeblendHook {

    /**
     * @param context    inputs the deblender received
     * @param rowsBefore catalog size just before this parent was dispatched
     * @param children   the child records created for this parent
     * @param result     the raw deblender result
     */
    void afterDeblend(DeblendContext context, int rowsBefore, List<SourceRecord> children, DeblendResult result);

    /**
     * A no-op hook.
     */
    PostDeblendHook NOOP = (context, rowsBefore, children, result) -> {};
}
