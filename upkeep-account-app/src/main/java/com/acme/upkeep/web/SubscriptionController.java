package com.acme.upkeep.web;

import com.acme.upkeep.codec.PerformDataCodec;
import com.acme.upkeep.domain.UpkeepCheck;
import com.acme.upkeep.service.RecurringPaymentAccount;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import java.util.HexFormat;
import java.util.List;

/** Read-only view over the account's subscriptions and pending upkeep. */
@Controller
public class SubscriptionController {

  private final RecurringPaymentAccount account;

  public SubscriptionController(RecurringPaymentAccount account) {
    this.account = account;
  }

  @Get("/subscriptions")
  public List<SubscriptionView> list() {
    return account.listSubscriptions().stream().map(SubscriptionView::from).toList();
  }

  @Get("/subscriptions/{id}")
  public SubscriptionView get(@PathVariable long id) {
    return SubscriptionView.from(account.getSubscription(id));
  }

  @Get("/upkeep")
  public UpkeepView upkeep() {
    UpkeepCheck check = account.checkUpkeep();
    return new UpkeepView(
        check.upkeepNeeded(),
        PerformDataCodec.decode(check.performData()),
        "0x" + HexFormat.of().formatHex(check.performData()));
  }
}
