package com.example.itop_notification.model;

/** Which tickets a deadline query looks at. */
public enum DeadlineScope {
  /** Tickets of the user's teams that nobody owns yet. */
  TEAM_UNASSIGNED,
  /** Tickets assigned to the user. */
  MINE
}
