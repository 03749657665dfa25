package com.example.itop_notification.service;

import com.example.itop_notification.model.Notification;

/** Final delivery target for notifications; deduplicates by the notification's object reference. */
public interface NotificationSink {

  default Notification.Builder createNotification() {
    return Notification.builder();
  }

  void notify(Notification notification);
}
