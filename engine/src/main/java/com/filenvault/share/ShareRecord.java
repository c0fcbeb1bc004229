package com.filenvault.share;

import com.filenvault.client.ItemShareRequest;
import com.filenvault.model.ItemType;

/**
 * One item shared with one recipient, metadata already encrypted under the recipient's
 * public key. Built fresh for each request from the server's current recipient list.
 */
public record ShareRecord(String itemUuid, String parentUuid, String recipientEmail, ItemType type,
                          String encryptedMetadata) {

    /** Parent sentinel of the item a share starts from. */
    public static final String NO_PARENT = "none";

    public ItemShareRequest toRequest() {
        return new ItemShareRequest(itemUuid, parentUuid, recipientEmail, type.shareName(), encryptedMetadata);
    }
}
