package org.pilens.pi.om;

/*
 * This file is part of PILens.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * PILens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * PILens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PILens.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Generic JSON form of an XML element: {@code {tag, attr?, text?, children?}}.
 * Trailing text after a child element is kept as a sibling pseudo-node tagged
 * {@value #TAIL_TAG}. Instances are immutable.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "tag", "attr", "text", "children" })
public final class SerializedNode {

	public static final String TAIL_TAG = "__tail__";

	private final String tag;
	private final Map<String, String> attr;
	private final String text;
	private final List<SerializedNode> children;

	public SerializedNode(String tag, Map<String, String> attr, String text, List<SerializedNode> children) {
		this.tag = tag;
		this.attr = (attr == null || attr.isEmpty()) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(attr));
		this.text = text;
		this.children = (children == null || children.isEmpty()) ? null : List.copyOf(children);
	}

	public static SerializedNode tail(String text) {
		return new SerializedNode(TAIL_TAG, null, text, null);
	}

	@JsonIgnore
	public boolean isTail() {
		return TAIL_TAG.equals(tag);
	}
}
