package com.di.pitnova.agent.validation;

import com.di.pitnova.model.Compound;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One historical pit stop. {@code lapNumber} is the in-lap; {@code newCompound} the tyre fitted.
 */
@Value
@Builder
@Jacksonized
public class PitStopRecord {
    String driverNumber;
    Integer lapNumber;
    Compound newCompound;
}
