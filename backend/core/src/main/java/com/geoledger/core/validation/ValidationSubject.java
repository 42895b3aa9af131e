package com.geoledger.core.validation;

import com.geoledger.core.model.Coordinates;
import com.geoledger.core.model.LocationFields;
import com.geoledger.core.model.TicketClass;

/**
 * Everything a validation rule may look at. All fields except location and class may be null.
 */
public record ValidationSubject(
        Coordinates coordinates,
        Double confidence,
        String technique,
        String approach,
        LocationFields location,
        TicketClass ticketClass
) {
    public ValidationSubject {
        location = location == null ? LocationFields.empty() : location;
        ticketClass = ticketClass == null ? TicketClass.unclassified() : ticketClass;
    }
}
