package io.qlogic.core.logic;

/// Converts logic trees to and from their persisted text form.
///
/// The editor encodes every structural snapshot it saves; loaders decode persisted trees.
/// Implementations must round-trip losslessly.
public interface LogicTreeCodec {

    /// Encodes a tree.
    ///
    /// @param tree tree to encode, not null
    /// @return serialized form, never null
    /// @throws IllegalArgumentException if the tree cannot be encoded
    String encode(LogicTree tree);

    /// Decodes a tree.
    ///
    /// @param serialized serialized form, not null
    /// @return decoded tree, never null
    /// @throws IllegalArgumentException if the input is malformed
    LogicTree decode(String serialized);
}
