package com.questrail.hamgateway.protocol.n1mm.validation;

import com.questrail.hamgateway.message.MessageValidator;
import com.questrail.hamgateway.protocol.n1mm.schema.ContactInfo;

/**
 * Accepts a {@link ContactInfo} only if it identifies a usable QSO:
 * <ul>
 *   <li>a non-blank worked call</li>
 *   <li>a non-blank station name or operator</li>
 *   <li>a timestamp</li>
 *   <li>a non-blank mode</li>
 * </ul>
 */
public final class ContactInfoMinimumContentValidator implements MessageValidator<ContactInfo>
{
    @Override
    public boolean isValid(ContactInfo message)
    {
        if (message == null) {
            return false;
        }

        return !isBlank(message.getCall())
            && (!isBlank(message.getStationName()) || !isBlank(message.getOperator()))
            && message.getTimestamp() != null
            && !isBlank(message.getMode());
    }

    private static boolean isBlank(String value)
    {
        return value == null || value.isBlank();
    }
}
