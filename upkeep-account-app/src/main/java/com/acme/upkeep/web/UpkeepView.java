package com.acme.upkeep.web;

import java.util.List;

/** Current poll result: due ids and the perform data a keeper would submit for them. */
public record UpkeepView(boolean upkeepNeeded, List<Long> ids, String performData) {}
