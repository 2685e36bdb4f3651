package com.bucketvault.application.venue;

import java.math.BigInteger;

public record BestQuote(VenueId venue, BigInteger amountOut) {}
