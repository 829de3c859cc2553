package com.eyelevel.invoiceingestion.service.notification;

import java.util.List;

public record OutboundMessage(String from, List<String> recipients, String subject, String body) {
}
