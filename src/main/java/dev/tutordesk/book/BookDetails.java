package dev.tutordesk.book;

import java.util.List;
import org.jspecify.annotations.Nullable;

/** Full view of one book block. */
public record BookDetails(
    String id,
    String title,
    String subject,
    MonthlyGoal monthlyGoal,
    @Nullable Integer unitLoad,
    List<Chapter> chapters) {}
