package com.recipenest.notification.api.service.directory;

import java.util.UUID;

/**
 * Read-only lookup of recipient contact details owned by the user service.
 */
public interface RecipientDirectory {

    /**
     * @return the recipient's email address
     * @throws com.recipenest.notification.api.service.NotFoundException if the recipient does not exist
     * @throws com.recipenest.notification.api.service.ServiceUnavailableException if the directory cannot be reached
     */
    String lookupContactAddress(UUID recipientId);
}
