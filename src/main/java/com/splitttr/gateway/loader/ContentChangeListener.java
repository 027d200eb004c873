package com.splitttr.gateway.loader;

import com.splitttr.gateway.contents.ContentModel;

/**
 * Observer of changes made to a resource outside of this process.
 */
@FunctionalInterface
public interface ContentChangeListener {

    void contentChanged(ContentModel model);
}
