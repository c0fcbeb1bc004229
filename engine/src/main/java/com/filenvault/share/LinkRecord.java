package com.filenvault.share;

import com.filenvault.client.DirLinkAddRequest;
import com.filenvault.model.ItemType;

/**
 * One item added to one public link. {@code encryptedMetadata} is under the link key and
 * {@code encryptedLinkKey} is the link key under the owner's hierarchy.
 */
public record LinkRecord(String itemUuid, String parentUuid, String linkUuid, ItemType type,
                         String encryptedMetadata, String encryptedLinkKey, String expiration) {

    /** Parent sentinel of the item a link starts from. */
    public static final String LINK_ROOT_PARENT = "base";

    public DirLinkAddRequest toRequest() {
        return new DirLinkAddRequest(itemUuid, parentUuid, linkUuid, type.shareName(), encryptedMetadata,
                encryptedLinkKey, expiration);
    }
}
