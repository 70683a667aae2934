package com.gamebook.models;

/**
 * A choice as recognized in page text, before it is bound to a node id.
 */
public record ExtractedChoice(String label, int destination) {
}
